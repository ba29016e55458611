package com.phillippitts.truthtell.domain;

/**
 * Category of a credibility pattern. Each category has its own match-count bucket
 * in {@link AnalysisResult#analysisDetails()}.
 */
public enum PatternCategory {
    SENSATIONALISM("sensationalism"),
    CLICKBAIT("clickbait"),
    CONSPIRACY("conspiracy"),
    CREDIBLE("credible_indicators");

    private final String detailKey;

    PatternCategory(String detailKey) {
        this.detailKey = detailKey;
    }

    /**
     * Key of this category's bucket in the per-category breakdown.
     */
    public String detailKey() {
        return detailKey;
    }
}
