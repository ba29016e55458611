package com.phillippitts.truthtell.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordinal credibility verdict derived from the confidence score.
 */
public enum Verdict {
    HIGHLY_CREDIBLE("Highly Credible"),
    SOMEWHAT_CREDIBLE("Somewhat Credible"),
    LOW_CREDIBILITY("Low Credibility");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Maps a confidence score to a verdict: above 70 is the top tier, 51 to 70 the middle tier,
     * 50 and below the lowest tier.
     */
    public static Verdict forConfidence(int confidence) {
        if (confidence > 70) {
            return HIGHLY_CREDIBLE;
        }
        if (confidence > 50) {
            return SOMEWHAT_CREDIBLE;
        }
        return LOW_CREDIBILITY;
    }
}
