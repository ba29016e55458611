package com.phillippitts.truthtell.service.credibility;

import com.phillippitts.truthtell.config.properties.CredibilityProperties;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reliability multiplier for the origin of a text.
 *
 * <p>A source string matches a configured source when it contains that source's URL or name
 * (case-insensitive). The first match wins; anything else gets the default reliability.
 * Range: 0.0 to 1.0.
 */
public final class SourceReliabilityPolicy {

    private final List<CredibilityProperties.Source> sources;
    private final double defaultReliability;

    public SourceReliabilityPolicy(List<CredibilityProperties.Source> sources, double defaultReliability) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources must not be null"));
        this.defaultReliability = defaultReliability;
    }

    public static SourceReliabilityPolicy from(CredibilityProperties properties) {
        return new SourceReliabilityPolicy(properties.getSources(), properties.getDefaultSourceReliability());
    }

    public double reliabilityFor(String source) {
        if (source == null || source.isBlank()) {
            return defaultReliability;
        }
        String normalized = source.toLowerCase(Locale.ROOT);
        for (CredibilityProperties.Source known : sources) {
            if (normalized.contains(known.getUrl().toLowerCase(Locale.ROOT))
                    || normalized.contains(known.getName().toLowerCase(Locale.ROOT))) {
                return known.getReliability();
            }
        }
        return defaultReliability;
    }
}
