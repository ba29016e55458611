package com.phillippitts.truthtell.service.live.message;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A message sent from the server to a live-stream client.
 * Serialized as a JSON object whose {@code type} field discriminates the variant.
 */
public interface OutboundMessage {

    @JsonProperty("type")
    String type();
}
