package com.phillippitts.truthtell.service.transcription;

import com.phillippitts.truthtell.config.properties.AssemblyAiProperties;
import com.phillippitts.truthtell.exception.TranscriptionException;
import com.phillippitts.truthtell.exception.TranscriptionExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link TranscriptionClient} for the AssemblyAI v2 REST API.
 *
 * <p>Protocol:
 * <ol>
 *   <li>{@code POST /v2/upload} with the raw audio; the response carries {@code upload_url}.</li>
 *   <li>{@code POST /v2/transcript} with {@code audio_url} and {@code language_code}; the
 *       response carries the transcript {@code id}.</li>
 *   <li>{@code GET /v2/transcript/{id}} is polled until {@code status} is {@code completed}
 *       (result in {@code text}) or {@code error} (reason in {@code error}).</li>
 * </ol>
 *
 * <p>Every failure surfaces as a {@link TranscriptionException} carrying the HTTP status
 * (when there is one) and the elapsed time. Calls are not retried.
 */
@Component
public class AssemblyAiTranscriptionClient implements TranscriptionClient {

    private static final Logger LOG = LogManager.getLogger(AssemblyAiTranscriptionClient.class);

    static final String PROVIDER = "assemblyai";

    private final RestClient rest;
    private final AssemblyAiProperties properties;

    public AssemblyAiTranscriptionClient(RestClient.Builder builder, AssemblyAiProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.rest = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, properties.getApiKey())
                .build();
    }

    @Override
    public String upload(byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new TranscriptionException("Audio must not be empty", PROVIDER);
        }
        long start = System.nanoTime();
        JSONObject response = exchange("upload", start, () -> rest.post()
                .uri("/v2/upload")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(audio)
                .retrieve()
                .body(String.class));
        String uploadUrl = requireField(response, "upload_url", start);
        LOG.debug("Uploaded {} bytes of audio", audio.length);
        return uploadUrl;
    }

    @Override
    public String transcribe(String handle, String language) {
        Objects.requireNonNull(handle, "handle must not be null");
        long start = System.nanoTime();

        JSONObject request = new JSONObject()
                .put("audio_url", handle)
                .put("language_code", language);
        JSONObject submitted = exchange("submit", start, () -> rest.post()
                .uri("/v2/transcript")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request.toString())
                .retrieve()
                .body(String.class));
        String id = requireField(submitted, "id", start);
        LOG.debug("Transcript {} submitted (language={})", id, language);

        return awaitCompletion(id, start);
    }

    private String awaitCompletion(String id, long start) {
        long deadline = start + properties.getTimeout().toNanos();
        while (true) {
            JSONObject transcript = exchange("poll", start, () -> rest.get()
                    .uri("/v2/transcript/{id}", id)
                    .retrieve()
                    .body(String.class));
            String status = transcript.optString("status", "");
            switch (status) {
                case "completed":
                    LOG.debug("Transcript {} completed in {} ms", id, elapsedMs(start));
                    return transcript.optString("text", "");
                case "error":
                    throw TranscriptionExceptionBuilder.create("Transcription failed: "
                                    + transcript.optString("error", "unknown error"))
                            .provider(PROVIDER)
                            .durationMs(elapsedMs(start))
                            .metadata("transcriptId", id)
                            .build();
                default:
                    break;
            }
            if (System.nanoTime() >= deadline) {
                throw TranscriptionExceptionBuilder.create("Timeout after " + properties.getTimeout())
                        .provider(PROVIDER)
                        .durationMs(elapsedMs(start))
                        .metadata("transcriptId", id)
                        .metadata("status", status)
                        .build();
            }
            pause(properties.getPollInterval(), start);
        }
    }

    private JSONObject exchange(String step, long start, Call call) {
        String body;
        try {
            body = call.execute();
        } catch (RestClientResponseException e) {
            throw TranscriptionExceptionBuilder.create("AssemblyAI " + step + " request rejected")
                    .provider(PROVIDER)
                    .httpStatus(e.getStatusCode().value())
                    .durationMs(elapsedMs(start))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw TranscriptionExceptionBuilder.create("AssemblyAI " + step + " request failed: " + e.getMessage())
                    .provider(PROVIDER)
                    .durationMs(elapsedMs(start))
                    .cause(e)
                    .build();
        }
        if (body == null || body.isBlank()) {
            throw TranscriptionExceptionBuilder.create("AssemblyAI " + step + " returned an empty body")
                    .provider(PROVIDER)
                    .durationMs(elapsedMs(start))
                    .build();
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw TranscriptionExceptionBuilder.create("AssemblyAI " + step + " returned malformed JSON")
                    .provider(PROVIDER)
                    .durationMs(elapsedMs(start))
                    .cause(e)
                    .build();
        }
    }

    private static String requireField(JSONObject json, String field, long start) {
        String value = json.optString(field, "");
        if (value.isBlank()) {
            throw TranscriptionExceptionBuilder.create("AssemblyAI response missing '" + field + "'")
                    .provider(PROVIDER)
                    .durationMs(elapsedMs(start))
                    .build();
        }
        return value;
    }

    private static void pause(Duration interval, long start) {
        if (interval.isZero() || interval.isNegative()) {
            return;
        }
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TranscriptionExceptionBuilder.create("Interrupted while waiting for transcript")
                    .provider(PROVIDER)
                    .durationMs(elapsedMs(start))
                    .cause(e)
                    .build();
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @FunctionalInterface
    private interface Call {
        String execute();
    }
}
