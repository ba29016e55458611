package com.phillippitts.truthtell.presentation.controller;

import com.phillippitts.truthtell.config.properties.LiveStreamProperties;
import com.phillippitts.truthtell.domain.AnalysisResult;
import com.phillippitts.truthtell.exception.InvalidRequestException;
import com.phillippitts.truthtell.service.credibility.CredibilityAnalyzer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores text supplied directly by the client, outside any live session.
 */
@RestController
class AnalysisController {

    private static final Logger LOG = LogManager.getLogger(AnalysisController.class);

    private final CredibilityAnalyzer analyzer;
    private final LiveStreamProperties liveProperties;

    AnalysisController(CredibilityAnalyzer analyzer, LiveStreamProperties liveProperties) {
        this.analyzer = analyzer;
        this.liveProperties = liveProperties;
    }

    @PostMapping("/api/analyze-text")
    ResponseEntity<Map<String, Object>> analyzeText(@RequestBody AnalyzeTextRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            throw new InvalidRequestException("text", "Text is required");
        }
        String language = request.language() == null ? liveProperties.getDefaultLanguage() : request.language();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type", "manual_input");
        metadata.put("language", language);
        AnalysisResult analysis = analyzer.analyze(request.text(), metadata);
        LOG.info("Manual text analyzed ({} chars, verdict={})", request.text().length(), analysis.verdict().label());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", request.text());
        body.put("analysis", analysis);
        body.put("success", true);
        return ResponseEntity.ok(body);
    }
}
