package com.phillippitts.truthtell.util;

import java.time.Duration;

/**
 * Timeout values for subprocess and reader-thread lifecycle management.
 *
 * @see com.phillippitts.truthtell.service.audio.YtDlpAudioSource
 */
public final class ProcessTimeouts {

    /**
     * Time granted to {@link Process#destroy()} before escalating to {@link Process#destroyForcibly()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Deadline for the process to disappear after {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * How long a stop waits for the reader thread to observe end-of-stream.
     */
    public static final Duration READER_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * How long the reader waits for the exit code after stdout reaches end-of-stream.
     */
    public static final Duration EXIT_CODE_TIMEOUT = Duration.ofSeconds(5);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
