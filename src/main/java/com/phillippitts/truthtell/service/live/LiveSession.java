package com.phillippitts.truthtell.service.live;

import com.phillippitts.truthtell.exception.ProducerException;
import com.phillippitts.truthtell.service.audio.AudioChunkListener;
import com.phillippitts.truthtell.service.audio.AudioSource;
import com.phillippitts.truthtell.service.audio.AudioStreamHandle;
import com.phillippitts.truthtell.service.live.event.AudioSourceFailureEvent;
import com.phillippitts.truthtell.service.live.message.ErrorMessage;
import com.phillippitts.truthtell.service.live.message.OutboundMessage;
import com.phillippitts.truthtell.service.live.message.StatusMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One live stream bound to one client connection: the audio producer plus its
 * {@link StreamProcessor}.
 *
 * <p>Producer callbacks are forwarded to the processor. A producer failure is reported to the
 * client and published as an {@link AudioSourceFailureEvent}; segments already queued keep
 * draining. {@link #close()} stops the processor and then the producer, and is triggered
 * either by the owning {@link LiveSessionManager} or by a sink failure.
 */
public final class LiveSession implements AudioChunkListener {

    private static final Logger LOG = LogManager.getLogger(LiveSession.class);

    static final String SOURCE_FAILED = "Audio source failed";
    static final String STREAM_ENDED = "Live stream ended";

    private final String sessionId;
    private final String connectionId;
    private final String sourceUrl;
    private final String platform;
    private final StreamProcessor processor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Consumer<LiveSession> onClosed;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile AudioStreamHandle handle;

    LiveSession(String sessionId,
                String connectionId,
                String sourceUrl,
                String platform,
                StreamProcessorBuilder processorBuilder,
                ApplicationEventPublisher publisher,
                Clock clock,
                Consumer<LiveSession> onClosed) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId must not be null");
        this.sourceUrl = Objects.requireNonNull(sourceUrl, "sourceUrl must not be null");
        this.platform = Objects.requireNonNull(platform, "platform must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.onClosed = Objects.requireNonNull(onClosed, "onClosed must not be null");
        this.processor = processorBuilder
                .sessionId(sessionId)
                .platform(platform)
                .clock(clock)
                .onSinkFailure(this::close)
                .build();
    }

    /**
     * Starts the audio producer.
     *
     * @throws ProducerException if the producer cannot be started
     */
    void start(AudioSource audioSource) {
        AudioStreamHandle started = audioSource.start(sourceUrl, this);
        handle = started;
        if (closed.get()) {
            started.stop();
        }
    }

    @Override
    public void onChunk(byte[] payload, Duration duration) {
        processor.processChunk(payload, duration);
    }

    @Override
    public void onError(ProducerException error) {
        LOG.warn("Audio producer failed for session {} ({}): {}", sessionId, platform, error.getMessage());
        publisher.publishEvent(new AudioSourceFailureEvent(sessionId, platform, "producer-failed", clock.instant()));
        processor.sendNotice(new ErrorMessage(SOURCE_FAILED, error.getMessage()));
    }

    @Override
    public void onComplete() {
        LOG.info("Audio producer finished for session {} ({})", sessionId, platform);
        processor.sendNotice(new StatusMessage(STREAM_ENDED, platform));
    }

    /**
     * Sends a notice through the processor so it respects the session's closed state.
     */
    public boolean sendNotice(OutboundMessage message) {
        return processor.sendNotice(message);
    }

    /**
     * Ends the session: discards pending audio, stops the producer and deregisters the session.
     * Idempotent.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        processor.close();
        AudioStreamHandle current = handle;
        if (current != null) {
            current.stop();
        }
        onClosed.accept(this);
        LOG.info("Live session {} closed", sessionId);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String sessionId() {
        return sessionId;
    }

    public String connectionId() {
        return connectionId;
    }

    public String platform() {
        return platform;
    }

    public SessionState state() {
        return processor.state();
    }

    StreamProcessor processor() {
        return processor;
    }
}
