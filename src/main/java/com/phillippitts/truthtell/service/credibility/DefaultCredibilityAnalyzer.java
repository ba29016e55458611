package com.phillippitts.truthtell.service.credibility;

import com.phillippitts.truthtell.config.properties.CredibilityProperties;
import com.phillippitts.truthtell.domain.AnalysisResult;
import com.phillippitts.truthtell.domain.CredibilityPattern;
import com.phillippitts.truthtell.domain.DetectedPattern;
import com.phillippitts.truthtell.domain.PatternCategory;
import com.phillippitts.truthtell.domain.Verdict;
import com.phillippitts.truthtell.exception.AnalysisException;
import com.phillippitts.truthtell.service.cache.CacheNamespace;
import com.phillippitts.truthtell.service.cache.ExpiringCache;
import com.phillippitts.truthtell.service.metrics.PipelineMetrics;
import com.phillippitts.truthtell.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rule-based credibility scoring with a read-through cache.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Start at 100.</li>
 *   <li>For each pattern, in table order, count case-insensitive non-overlapping occurrences
 *       of its trigger. A pattern with at least one match adds {@code weight * count} to the
 *       score, adds {@code count} to its category bucket and is reported as detected.</li>
 *   <li>If enabled, texts shorter than the configured word count lose a fixed penalty.</li>
 *   <li>If metadata carries a {@code source}, the score is multiplied by its reliability.</li>
 *   <li>The score is clamped to [10, 100] and rounded; the verdict is derived from the result.</li>
 * </ol>
 *
 * <p><b>Caching:</b> results are cached in {@link CacheNamespace#ANALYSIS} under the first
 * {@code credibility.cache-key-length} characters of the text. A hit is returned as is, so its
 * metadata belongs to the call that populated the entry. Cache failures are logged and
 * scoring proceeds uncached.
 *
 * <p><b>Thread Safety:</b> stateless apart from the shared cache; safe for concurrent use.
 */
public class DefaultCredibilityAnalyzer implements CredibilityAnalyzer {

    private static final Logger LOG = LogManager.getLogger(DefaultCredibilityAnalyzer.class);

    static final String TEXT_LENGTH_KEY = "text_length";
    static final String TIMESTAMP_KEY = "analysis_timestamp";
    static final String SOURCE_KEY = "source";

    private final PatternTable patternTable;
    private final ExpiringCache cache;
    private final SourceReliabilityPolicy reliabilityPolicy;
    private final CredibilityProperties properties;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public DefaultCredibilityAnalyzer(PatternTable patternTable,
                                      ExpiringCache cache,
                                      SourceReliabilityPolicy reliabilityPolicy,
                                      CredibilityProperties properties,
                                      PipelineMetrics metrics,
                                      Clock clock) {
        this.patternTable = Objects.requireNonNull(patternTable, "patternTable must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.reliabilityPolicy = Objects.requireNonNull(reliabilityPolicy, "reliabilityPolicy must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public AnalysisResult analyze(String text, Map<String, Object> metadata) {
        Objects.requireNonNull(text, "text must not be null");
        String key = cacheKey(text);

        Optional<AnalysisResult> cached = lookup(key);
        if (cached.isPresent()) {
            metrics.incrementCacheHit();
            LOG.debug("Analysis cache hit for text '{}'", LogSanitizer.preview(text));
            return cached.get();
        }
        metrics.incrementCacheMiss();

        AnalysisResult result;
        try {
            result = score(text, metadata == null ? Map.of() : metadata);
        } catch (RuntimeException e) {
            throw new AnalysisException("Credibility scoring failed: " + e.getMessage(), e);
        }
        metrics.recordVerdict(result.verdict().label());
        store(key, result);
        return result;
    }

    private AnalysisResult score(String text, Map<String, Object> metadata) {
        double score = 100;
        Map<String, Integer> details = new LinkedHashMap<>();
        for (PatternCategory category : PatternCategory.values()) {
            details.put(category.detailKey(), 0);
        }
        List<DetectedPattern> detected = new ArrayList<>();

        String haystack = text.toLowerCase(Locale.ROOT);
        for (CredibilityPattern pattern : patternTable.patterns()) {
            int matches = countOccurrences(haystack, pattern.normalizedTrigger());
            if (matches > 0) {
                score += (double) pattern.weight() * matches;
                details.merge(pattern.category().detailKey(), matches, Integer::sum);
                detected.add(DetectedPattern.matched(pattern, matches));
            }
        }

        int words = wordCount(text);
        CredibilityProperties.ShortContent shortContent = properties.getShortContent();
        if (shortContent.isEnabled() && words < shortContent.getMinWords()) {
            score -= shortContent.getPenalty();
            detected.add(DetectedPattern.shortContent(shortContent.getPenalty()));
        }

        Object source = metadata.get(SOURCE_KEY);
        if (source != null) {
            score *= reliabilityPolicy.reliabilityFor(source.toString());
        }

        int confidence = clamp(score);
        Map<String, Object> resultMetadata = new LinkedHashMap<>(metadata);
        resultMetadata.put(TEXT_LENGTH_KEY, words);
        resultMetadata.put(TIMESTAMP_KEY, clock.instant().toString());

        return new AnalysisResult(Verdict.forConfidence(confidence), confidence, details, detected, resultMetadata);
    }

    private Optional<AnalysisResult> lookup(String key) {
        try {
            return cache.get(CacheNamespace.ANALYSIS, key, AnalysisResult.class);
        } catch (RuntimeException e) {
            LOG.warn("Analysis cache read failed, scoring uncached: {}", e.toString());
            return Optional.empty();
        }
    }

    private void store(String key, AnalysisResult result) {
        try {
            cache.set(CacheNamespace.ANALYSIS, key, result, properties.getCacheTtl());
        } catch (RuntimeException e) {
            LOG.warn("Analysis cache write failed: {}", e.toString());
        }
    }

    String cacheKey(String text) {
        int length = properties.getCacheKeyLength();
        return text.length() <= length ? text : text.substring(0, length);
    }

    /**
     * Counts non-overlapping occurrences of {@code needle} in {@code haystack}.
     */
    static int countOccurrences(String haystack, String needle) {
        if (needle.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        while (true) {
            int idx = haystack.indexOf(needle, from);
            if (idx < 0) {
                return count;
            }
            count++;
            from = idx + needle.length();
        }
    }

    static int wordCount(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    static int clamp(double score) {
        double bounded = Math.max(AnalysisResult.MIN_CONFIDENCE, Math.min(score, AnalysisResult.MAX_CONFIDENCE));
        return (int) Math.round(bounded);
    }
}
