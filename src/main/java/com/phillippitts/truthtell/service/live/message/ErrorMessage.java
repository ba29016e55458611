package com.phillippitts.truthtell.service.live.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Failure notice for one segment or for the session as a whole.
 *
 * @param error   short summary
 * @param details optional cause description
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "error", "details"})
public record ErrorMessage(String error, String details) implements OutboundMessage {

    public static final String TYPE = "error";

    public ErrorMessage {
        Objects.requireNonNull(error, "error must not be null");
    }

    public static ErrorMessage of(String error) {
        return new ErrorMessage(error, null);
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
