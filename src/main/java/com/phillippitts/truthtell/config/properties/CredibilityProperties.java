package com.phillippitts.truthtell.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for credibility scoring and its result cache.
 *
 * <p>Note: Bean created via {@link com.phillippitts.truthtell.TruthTellApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@Validated
@ConfigurationProperties(prefix = "credibility")
public class CredibilityProperties {

    /** Number of leading characters of a text used as the analysis cache key. */
    @Positive
    private int cacheKeyLength = 100;

    /** How long a cached analysis stays valid. */
    @NotNull
    private Duration cacheTtl = Duration.ofHours(1);

    /** Reliability multiplier for a metadata source that matches no configured source. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultSourceReliability = 0.7;

    @Valid
    private ShortContent shortContent = new ShortContent();

    @Valid
    private List<Source> sources = defaultSources();

    public int getCacheKeyLength() {
        return cacheKeyLength;
    }

    public void setCacheKeyLength(int cacheKeyLength) {
        this.cacheKeyLength = cacheKeyLength;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public double getDefaultSourceReliability() {
        return defaultSourceReliability;
    }

    public void setDefaultSourceReliability(double defaultSourceReliability) {
        this.defaultSourceReliability = defaultSourceReliability;
    }

    public ShortContent getShortContent() {
        return shortContent;
    }

    public void setShortContent(ShortContent shortContent) {
        this.shortContent = shortContent;
    }

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources;
    }

    private static List<Source> defaultSources() {
        List<Source> list = new ArrayList<>();
        list.add(new Source("Times of India", "https://timesofindia.indiatimes.com/rssfeedstopstories.cms", 0.8));
        list.add(new Source("The Hindu", "https://www.thehindu.com/news/national/feeder/default.rss", 0.85));
        return list;
    }

    /**
     * Optional penalty for texts too short to judge. Disabled by default.
     */
    public static class ShortContent {
        private boolean enabled = false;

        @Min(1)
        private int minWords = 50;

        @Min(0)
        private int penalty = 15;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMinWords() {
            return minWords;
        }

        public void setMinWords(int minWords) {
            this.minWords = minWords;
        }

        public int getPenalty() {
            return penalty;
        }

        public void setPenalty(int penalty) {
            this.penalty = penalty;
        }
    }

    /**
     * Known news source and its reliability multiplier.
     */
    public static class Source {
        @NotBlank
        private String name;

        @NotBlank
        private String url;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double reliability;

        public Source() {
        }

        public Source(String name, String url, double reliability) {
            this.name = name;
            this.url = url;
            this.reliability = reliability;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public double getReliability() {
            return reliability;
        }

        public void setReliability(double reliability) {
            this.reliability = reliability;
        }
    }
}
