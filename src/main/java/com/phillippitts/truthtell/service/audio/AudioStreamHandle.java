package com.phillippitts.truthtell.service.audio;

/**
 * Control handle of a running audio producer.
 */
public interface AudioStreamHandle {

    /**
     * Stops the producer and waits briefly for it to exit. After this returns no further
     * listener callbacks are delivered. Idempotent.
     */
    void stop();

    boolean isRunning();
}
