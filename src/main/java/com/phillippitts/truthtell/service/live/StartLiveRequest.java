package com.phillippitts.truthtell.service.live;

import java.util.Objects;

/**
 * Parsed {@code start_live} control message.
 *
 * @param url      source identifier of the live stream
 * @param language transcription language code
 */
public record StartLiveRequest(String url, String language) {

    public StartLiveRequest {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(language, "language must not be null");
    }
}
