package com.phillippitts.truthtell.service.live;

/**
 * Lifecycle of one live session as seen by its {@link StreamProcessor}.
 *
 * <pre>
 * IDLE → BUFFERING (first chunk)
 * BUFFERING → FLUSH_READY (flush interval elapsed, segment queued)
 * FLUSH_READY → DRAINING (transcription in flight)
 * DRAINING → EMITTED (result or error sent)
 * EMITTED → DRAINING (more queued) | BUFFERING (queue empty)
 * any → CLOSED (session terminated)
 * </pre>
 */
public enum SessionState {
    IDLE,
    BUFFERING,
    FLUSH_READY,
    DRAINING,
    EMITTED,
    CLOSED
}
