package com.phillippitts.truthtell.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable scoring rule: every case-insensitive occurrence of {@code trigger} in a text
 * adjusts the credibility score by {@code weight}.
 *
 * @param trigger  word or short phrase to look for (must not be blank)
 * @param weight   signed score adjustment per occurrence
 * @param category category bucket the matches are counted in
 */
public record CredibilityPattern(String trigger, int weight, PatternCategory category) {

    public CredibilityPattern {
        Objects.requireNonNull(trigger, "trigger must not be null");
        if (trigger.isBlank()) {
            throw new IllegalArgumentException("trigger must not be blank");
        }
        Objects.requireNonNull(category, "category must not be null");
    }

    /**
     * Lower-cased trigger used for case-insensitive matching.
     */
    public String normalizedTrigger() {
        return trigger.toLowerCase(Locale.ROOT);
    }
}
