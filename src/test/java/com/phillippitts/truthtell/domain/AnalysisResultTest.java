package com.phillippitts.truthtell.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisResultTest {

    @Test
    void shouldRejectConfidenceOutsideRange() {
        assertThatThrownBy(() -> new AnalysisResult(Verdict.LOW_CREDIBILITY, 9, Map.of(), List.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 10 and 100");
        assertThatThrownBy(() -> new AnalysisResult(Verdict.HIGHLY_CREDIBLE, 101, Map.of(), List.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCopyCollectionsDefensively() {
        // Arrange
        List<DetectedPattern> patterns = new ArrayList<>();
        patterns.add(DetectedPattern.matched(new CredibilityPattern("viral", -6, PatternCategory.CLICKBAIT), 1));

        // Act
        AnalysisResult result = new AnalysisResult(Verdict.HIGHLY_CREDIBLE, 94, Map.of("clickbait", 1), patterns, null);
        patterns.clear();

        // Assert
        assertThat(result.detectedPatterns()).hasSize(1);
        assertThat(result.metadata()).isEmpty();
    }

    @Test
    void shouldSerializeWithSnakeCaseFieldsAndVerdictLabel() throws Exception {
        // Arrange
        AnalysisResult result = new AnalysisResult(Verdict.SOMEWHAT_CREDIBLE, 60,
                Map.of("sensationalism", 1),
                List.of(DetectedPattern.matched(new CredibilityPattern("shocking", -8, PatternCategory.SENSATIONALISM), 5),
                        DetectedPattern.shortContent(15)),
                Map.of("type", "manual_input"));

        // Act
        JsonNode json = new ObjectMapper().valueToTree(result);

        // Assert
        assertThat(json.get("verdict").asText()).isEqualTo("Somewhat Credible");
        assertThat(json.get("confidence").asInt()).isEqualTo(60);
        assertThat(json.get("analysis_details").get("sensationalism").asInt()).isEqualTo(1);
        JsonNode first = json.get("detected_patterns").get(0);
        assertThat(first.get("pattern").asText()).isEqualTo("shocking");
        assertThat(first.get("category").asText()).isEqualTo("SENSATIONALISM");
        assertThat(first.get("impact").asInt()).isEqualTo(-40);
        JsonNode length = json.get("detected_patterns").get(1);
        assertThat(length.has("pattern")).isFalse();
        assertThat(length.get("category").asText()).isEqualTo("LENGTH");
        assertThat(length.get("detail").asText()).isEqualTo("Very short content");
    }
}
