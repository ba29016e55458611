package com.phillippitts.truthtell.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One audio chunk accepted by the sliding window buffer.
 *
 * @param payload   opaque audio bytes as produced by the source
 * @param duration  declared duration of the chunk
 * @param arrivedAt when the chunk was accepted
 */
public record AudioSegment(byte[] payload, Duration duration, Instant arrivedAt) {

    public AudioSegment {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative, got: " + duration);
        }
        Objects.requireNonNull(arrivedAt, "arrivedAt must not be null");
    }
}
