package com.phillippitts.truthtell.service.live.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Informational notice (connection established, stream started or ended).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "message", "platform"})
public record StatusMessage(String message, String platform) implements OutboundMessage {

    public static final String TYPE = "status";

    public StatusMessage {
        Objects.requireNonNull(message, "message must not be null");
    }

    public static StatusMessage of(String message) {
        return new StatusMessage(message, null);
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
