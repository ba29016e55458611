package com.phillippitts.truthtell.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One scoring adjustment applied during an analysis.
 *
 * @param pattern  trigger text that matched ({@code null} for non-pattern adjustments)
 * @param category category name (a {@link PatternCategory} name, or {@code LENGTH})
 * @param count    number of non-overlapping matches
 * @param impact   signed score change contributed by this entry
 * @param detail   human-readable note for non-pattern adjustments ({@code null} otherwise)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectedPattern(String pattern, String category, Integer count, int impact, String detail) {

    public static final String LENGTH_CATEGORY = "LENGTH";

    public static DetectedPattern matched(CredibilityPattern rule, int count) {
        return new DetectedPattern(rule.trigger(), rule.category().name(), count, rule.weight() * count, null);
    }

    public static DetectedPattern shortContent(int penalty) {
        return new DetectedPattern(null, LENGTH_CATEGORY, null, -penalty, "Very short content");
    }
}
