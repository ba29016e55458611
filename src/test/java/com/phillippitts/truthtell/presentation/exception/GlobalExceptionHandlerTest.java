package com.phillippitts.truthtell.presentation.exception;

import com.phillippitts.truthtell.exception.AnalysisException;
import com.phillippitts.truthtell.exception.InvalidRequestException;
import com.phillippitts.truthtell.exception.ProducerException;
import com.phillippitts.truthtell.exception.TranscriptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesInvalidRequestReturns400WithField() {
        InvalidRequestException ex = new InvalidRequestException("video_url", "Video URL is required");

        ResponseEntity<?> response = handler.handleInvalidRequest(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("InvalidRequestException")
                .contains("Video URL is required")
                .contains("field: video_url");
    }

    @Test
    void verifiesUnreadableBodyReturns400() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "JSON parse error", new IOException("Unexpected character"), mock(HttpInputMessage.class));

        ResponseEntity<?> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("Malformed request body");
    }

    @Test
    void verifiesProducerFailureReturns502WithoutExposingUrl() {
        ProducerException ex = new ProducerException("Download failed with code 1",
                "https://www.youtube.com/watch?v=private-token");

        ResponseEntity<?> response = handler.handleProducerFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().toString())
                .contains("Failed to fetch audio")
                .doesNotContain("private-token");
    }

    @Test
    void verifiesTranscriptionFailureReturns503() {
        TranscriptionException ex = new TranscriptionException("Transcription timed out", "assemblyai");

        ResponseEntity<?> response = handler.handleTranscriptionFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("TranscriptionException")
                .contains("temporarily unavailable")
                .contains("retry");
    }

    @Test
    void verifiesTranscriptionFailureDoesNotExposeProviderMessage() {
        TranscriptionException ex = new TranscriptionException("Invalid API key: sk-secret123", "assemblyai");

        ResponseEntity<?> response = handler.handleTranscriptionFailure(ex);

        assertThat(response.getBody().toString()).doesNotContain("sk-secret123");
    }

    @Test
    void verifiesAnalysisFailureReturns500() {
        AnalysisException ex = new AnalysisException("pattern table is empty");

        ResponseEntity<?> response = handler.handleAnalysisFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("Failed to analyze text");
    }

    @Test
    void verifiesUnexpectedReturnsGenericBody() {
        Exception ex = new IllegalStateException("Bad state with internal detail");

        ResponseEntity<?> response = handler.handleUnexpected(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .contains("unexpected error")
                .doesNotContain("internal detail")
                .doesNotContain("IllegalStateException");
    }

    @Test
    void verifiesErrorResponseHasValidStructure() {
        ResponseEntity<?> response = handler.handleInvalidRequest(new InvalidRequestException("text", "Text is required"));

        String bodyStr = response.getBody().toString();
        assertThat(bodyStr).contains("errorCode=");
        assertThat(bodyStr).contains("message=");
        assertThat(bodyStr).contains("details=");
        assertThat(bodyStr).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
