package com.phillippitts.truthtell.service.credibility;

import com.phillippitts.truthtell.domain.AnalysisResult;
import com.phillippitts.truthtell.exception.AnalysisException;

import java.util.Map;

/**
 * Scores a text for credibility using the shared pattern table.
 *
 * <p>Used by the live pipeline for every transcribed segment and by one-shot REST flows.
 * Implementations may serve results from a cache keyed by a prefix of the text, in which case
 * a hit returns the first caller's result, metadata included.
 */
public interface CredibilityAnalyzer {

    /**
     * Analyzes a text.
     *
     * @param text text to score (must not be null; may be empty)
     * @param metadata caller context copied into the result (may be empty)
     * @return scored result
     * @throws AnalysisException if scoring fails
     */
    AnalysisResult analyze(String text, Map<String, Object> metadata);
}
