package com.phillippitts.truthtell.service.live.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.phillippitts.truthtell.domain.AnalysisResult;

import java.util.Objects;

/**
 * One transcribed and scored segment.
 *
 * @param text      transcribed text
 * @param platform  platform the stream originates from
 * @param analysis  credibility analysis of {@code text}
 * @param timestamp emission time in epoch milliseconds
 */
@JsonPropertyOrder({"type", "text", "platform", "analysis", "timestamp"})
public record TranscriptionMessage(String text, String platform, AnalysisResult analysis, long timestamp)
        implements OutboundMessage {

    public static final String TYPE = "transcription";

    public TranscriptionMessage {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(analysis, "analysis must not be null");
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
