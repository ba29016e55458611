package com.phillippitts.truthtell.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A flushed window waiting for transcription: the concatenated payload of every segment
 * that was in the buffer at flush time.
 *
 * @param payload   concatenated audio bytes (never empty)
 * @param flushedAt when the buffer was flushed
 */
public record QueueEntry(byte[] payload, Instant flushedAt) {

    public QueueEntry {
        Objects.requireNonNull(payload, "payload must not be null");
        if (payload.length == 0) {
            throw new IllegalArgumentException("payload must not be empty");
        }
        Objects.requireNonNull(flushedAt, "flushedAt must not be null");
    }
}
