package com.phillippitts.truthtell.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of a credibility analysis.
 *
 * @param verdict          ordinal verdict derived from {@code confidence}
 * @param confidence       score clamped to [{@value #MIN_CONFIDENCE}, {@value #MAX_CONFIDENCE}]
 * @param analysisDetails  match count per category, keyed by {@link PatternCategory#detailKey()}
 * @param detectedPatterns adjustments in evaluation order
 * @param metadata         caller metadata plus {@code text_length} and {@code analysis_timestamp}
 */
public record AnalysisResult(
        Verdict verdict,
        int confidence,
        @JsonProperty("analysis_details") Map<String, Integer> analysisDetails,
        @JsonProperty("detected_patterns") List<DetectedPattern> detectedPatterns,
        Map<String, Object> metadata
) {

    public static final int MIN_CONFIDENCE = 10;
    public static final int MAX_CONFIDENCE = 100;

    public AnalysisResult {
        Objects.requireNonNull(verdict, "verdict must not be null");
        if (confidence < MIN_CONFIDENCE || confidence > MAX_CONFIDENCE) {
            throw new IllegalArgumentException(
                    "Confidence must be between " + MIN_CONFIDENCE + " and " + MAX_CONFIDENCE + ", got: " + confidence);
        }
        analysisDetails = Collections.unmodifiableMap(new LinkedHashMap<>(analysisDetails));
        detectedPatterns = List.copyOf(detectedPatterns);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
