package com.phillippitts.truthtell.service.live;

import com.phillippitts.truthtell.domain.AnalysisResult;
import com.phillippitts.truthtell.domain.QueueEntry;
import com.phillippitts.truthtell.exception.AnalysisException;
import com.phillippitts.truthtell.exception.SinkException;
import com.phillippitts.truthtell.exception.TranscriptionException;
import com.phillippitts.truthtell.service.credibility.CredibilityAnalyzer;
import com.phillippitts.truthtell.service.live.message.ErrorMessage;
import com.phillippitts.truthtell.service.live.message.OutboundMessage;
import com.phillippitts.truthtell.service.live.message.TranscriptionMessage;
import com.phillippitts.truthtell.service.metrics.PipelineMetrics;
import com.phillippitts.truthtell.service.transcription.TranscriptionClient;
import com.phillippitts.truthtell.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session pipeline from audio chunks to emitted transcription results.
 *
 * <p><b>Ingestion:</b> {@link #processChunk} is the only entry point for audio. It feeds the
 * {@link SlidingWindowBuffer}; when the buffer reports a flush is due, the buffered bytes are
 * taken and the buffer cleared in one step, and a non-empty payload is appended to the pending
 * queue as a {@link QueueEntry}.
 *
 * <p><b>Draining:</b> {@link #processQueue} takes entries strictly in FIFO order and runs
 * upload → transcribe → analyze for each, emitting exactly one message per entry (a
 * transcription or an error). A drain already in progress makes further calls a no-op, so at
 * most one transcription call is in flight per processor and messages are emitted in the order
 * their segments were flushed. Segment failures never stop the drain.
 *
 * <p><b>Backpressure:</b> the pending queue holds at most {@code maxQueuedSegments} entries;
 * on overflow the oldest pending entry is dropped and counted.
 *
 * <p><b>Closing:</b> {@link #close()} discards queued and buffered audio. A transcription
 * already in flight is allowed to finish, but its result is never emitted.
 *
 * <p><b>Thread Safety:</b> buffer, queue, flags and state are guarded by one lock. External
 * calls (transcription, analysis) run outside the lock; sink delivery runs under it so that a
 * message is never sent after {@link #close()} returns.
 *
 * @see StreamProcessorBuilder
 */
public final class StreamProcessor {

    private static final Logger LOG = LogManager.getLogger(StreamProcessor.class);

    static final String SEGMENT_ERROR = "Stream processing failed";
    static final String LIVE_STREAM_TYPE = "live_stream";

    private final String sessionId;
    private final String platform;
    private final String language;
    private final SlidingWindowBuffer buffer;
    private final int maxQueuedSegments;
    private final TranscriptionClient transcriptionClient;
    private final CredibilityAnalyzer analyzer;
    private final LiveSessionSink sink;
    private final Executor drainExecutor;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Runnable sinkFailureHandler;

    private final Lock lock = new ReentrantLock();
    private final Deque<QueueEntry> pending = new ArrayDeque<>();
    private SessionState state = SessionState.IDLE;
    private boolean draining;
    private boolean closed;

    StreamProcessor(StreamProcessorBuilder builder) {
        this.sessionId = builder.sessionId;
        this.platform = builder.platform;
        this.language = builder.language;
        this.buffer = builder.buffer;
        this.maxQueuedSegments = builder.maxQueuedSegments;
        this.transcriptionClient = builder.transcriptionClient;
        this.analyzer = builder.analyzer;
        this.sink = builder.sink;
        this.drainExecutor = builder.drainExecutor;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.sinkFailureHandler = builder.sinkFailureHandler;
    }

    /**
     * Accepts one audio chunk. Flushes the buffer into the pending queue when due and
     * schedules a drain if none is running.
     */
    public void processChunk(byte[] payload, Duration duration) {
        boolean scheduleDrain = false;
        lock.lock();
        try {
            if (closed) {
                LOG.debug("Chunk ignored, session {} is closed", sessionId);
                return;
            }
            boolean flushDue = buffer.addChunk(payload, duration);
            if (state == SessionState.IDLE) {
                state = SessionState.BUFFERING;
            }
            if (!flushDue) {
                return;
            }

            byte[] segment = buffer.getBuffer();
            buffer.clear();
            if (segment.length == 0) {
                LOG.debug("Flush produced no audio, nothing queued");
                return;
            }
            enqueue(new QueueEntry(segment, clock.instant()));
            if (!draining) {
                state = SessionState.FLUSH_READY;
                scheduleDrain = true;
            }
        } finally {
            lock.unlock();
        }

        if (scheduleDrain) {
            scheduleDrain();
        }
    }

    // Caller holds the lock
    private void enqueue(QueueEntry entry) {
        if (pending.size() >= maxQueuedSegments) {
            QueueEntry dropped = pending.pollFirst();
            metrics.incrementSegmentsDropped();
            LOG.warn("Pending queue full ({} segments), dropped oldest segment flushed at {}",
                    maxQueuedSegments, dropped.flushedAt());
        }
        pending.addLast(entry);
        metrics.incrementSegmentsFlushed();
        LOG.debug("Queued segment of {} bytes ({} pending)", entry.payload().length, pending.size());
    }

    private void scheduleDrain() {
        try {
            drainExecutor.execute(this::processQueue);
        } catch (RejectedExecutionException e) {
            LOG.warn("Drain task rejected for session {}; pending segments wait for the next flush: {}",
                    sessionId, e.toString());
        }
    }

    /**
     * Drains the pending queue until it is empty or the session closes.
     * Returns immediately when a drain is already running or the session is closed.
     */
    public void processQueue() {
        lock.lock();
        try {
            if (draining || closed) {
                return;
            }
            draining = true;
        } finally {
            lock.unlock();
        }

        boolean finished = false;
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", sessionId)) {
            drainLoop();
            finished = true;
        } finally {
            if (!finished) {
                resetDraining();
            }
        }
    }

    private void drainLoop() {
        while (true) {
            QueueEntry entry;
            lock.lock();
            try {
                entry = closed ? null : pending.pollFirst();
                if (entry == null) {
                    draining = false;
                    if (!closed) {
                        state = SessionState.BUFFERING;
                    }
                    return;
                }
                state = SessionState.DRAINING;
            } finally {
                lock.unlock();
            }

            OutboundMessage message = process(entry);
            if (!emit(message, true)) {
                resetDraining();
                return;
            }
        }
    }

    private void resetDraining() {
        lock.lock();
        try {
            draining = false;
        } finally {
            lock.unlock();
        }
    }

    private OutboundMessage process(QueueEntry entry) {
        String text;
        long start = System.nanoTime();
        try {
            String handle = transcriptionClient.upload(entry.payload());
            text = transcriptionClient.transcribe(handle, language);
        } catch (TranscriptionException e) {
            return segmentFailure("transcription", entry, e);
        } catch (RuntimeException e) {
            return segmentFailure("unexpected", entry, e);
        } finally {
            metrics.recordTranscriptionLatency(System.nanoTime() - start);
        }

        if (text == null || text.isBlank()) {
            return segmentFailure("transcription", entry,
                    new TranscriptionException("Transcription returned no text", transcriptionClient.providerName()));
        }

        try {
            AnalysisResult analysis = analyzer.analyze(text, liveMetadata());
            metrics.incrementTranscriptionSuccess();
            LOG.info("Segment transcribed: '{}' (verdict={}, confidence={})",
                    LogSanitizer.preview(text), analysis.verdict().label(), analysis.confidence());
            return new TranscriptionMessage(text, platform, analysis, clock.millis());
        } catch (AnalysisException e) {
            return segmentFailure("analysis", entry, e);
        } catch (RuntimeException e) {
            return segmentFailure("unexpected", entry, e);
        }
    }

    private ErrorMessage segmentFailure(String reason, QueueEntry entry, RuntimeException e) {
        metrics.incrementTranscriptionFailure(reason);
        LOG.warn("Segment flushed at {} failed ({}): {}", entry.flushedAt(), reason, e.getMessage());
        return new ErrorMessage(SEGMENT_ERROR, e.getMessage());
    }

    private Map<String, Object> liveMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type", LIVE_STREAM_TYPE);
        metadata.put("platform", platform);
        metadata.put("timestamp", clock.millis());
        return metadata;
    }

    /**
     * Sends a message that is not tied to a segment (producer error, end of stream).
     *
     * @return {@code true} if delivered, {@code false} if the session is closed or delivery failed
     */
    public boolean sendNotice(OutboundMessage message) {
        return emit(message, false);
    }

    private boolean emit(OutboundMessage message, boolean segmentResult) {
        SinkException failure;
        lock.lock();
        try {
            if (closed) {
                LOG.debug("Session {} closed, discarding {} message", sessionId, message.type());
                return false;
            }
            try {
                sink.send(message);
                if (segmentResult) {
                    state = SessionState.EMITTED;
                }
                return true;
            } catch (SinkException e) {
                failure = e;
            }
        } finally {
            lock.unlock();
        }

        metrics.incrementSinkFailure();
        LOG.warn("Could not deliver {} message to session {}, closing: {}",
                message.type(), sessionId, failure.getMessage());
        sinkFailureHandler.run();
        return false;
    }

    /**
     * Closes the processor. Queued and buffered audio is discarded and nothing is emitted
     * afterwards. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            state = SessionState.CLOSED;
            int discarded = pending.size();
            pending.clear();
            buffer.clear();
            LOG.info("Stream processor closed for session {} ({} pending segments discarded)", sessionId, discarded);
        } finally {
            lock.unlock();
        }
    }

    public SessionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isDraining() {
        lock.lock();
        try {
            return draining;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public String sessionId() {
        return sessionId;
    }

    public String platform() {
        return platform;
    }
}
