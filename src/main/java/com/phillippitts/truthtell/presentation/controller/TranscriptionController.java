package com.phillippitts.truthtell.presentation.controller;

import com.phillippitts.truthtell.config.properties.LiveStreamProperties;
import com.phillippitts.truthtell.exception.InvalidRequestException;
import com.phillippitts.truthtell.service.transcription.RecordedTranscription;
import com.phillippitts.truthtell.service.transcription.RecordedTranscriptionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transcribes and scores a recorded video in one request.
 */
@RestController
class TranscriptionController {

    private final RecordedTranscriptionService transcriptionService;
    private final LiveStreamProperties liveProperties;

    TranscriptionController(RecordedTranscriptionService transcriptionService, LiveStreamProperties liveProperties) {
        this.transcriptionService = transcriptionService;
        this.liveProperties = liveProperties;
    }

    @PostMapping("/api/transcribe-recorded")
    ResponseEntity<Map<String, Object>> transcribeRecorded(@RequestBody TranscribeRecordedRequest request) {
        if (request.videoUrl() == null || request.videoUrl().isBlank()) {
            throw new InvalidRequestException("video_url", "Video URL is required");
        }
        String language = request.language() == null ? liveProperties.getDefaultLanguage() : request.language();

        RecordedTranscription result = transcriptionService.transcribe(request.videoUrl(), language);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", result.text());
        body.put("platform", result.platform());
        body.put("analysis", result.analysis());
        body.put("success", true);
        return ResponseEntity.ok(body);
    }
}
