package com.phillippitts.truthtell.service.audio;

import com.phillippitts.truthtell.exception.ProducerException;

import java.time.Duration;

/**
 * Receives audio from a running producer. Callbacks arrive on the producer's reader thread,
 * in order, and stop after {@link #onError} or {@link #onComplete}.
 */
public interface AudioChunkListener {

    void onChunk(byte[] payload, Duration duration);

    /**
     * The producer failed; no further chunks follow.
     */
    void onError(ProducerException error);

    /**
     * The producer reached the end of the stream normally.
     */
    void onComplete();
}
