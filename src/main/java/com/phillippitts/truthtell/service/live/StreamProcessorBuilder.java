package com.phillippitts.truthtell.service.live;

import com.phillippitts.truthtell.service.credibility.CredibilityAnalyzer;
import com.phillippitts.truthtell.service.metrics.PipelineMetrics;
import com.phillippitts.truthtell.service.transcription.TranscriptionClient;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link StreamProcessor}.
 *
 * <pre>{@code
 * StreamProcessor processor = StreamProcessorBuilder.builder()
 *     .sessionId(id)
 *     .platform("youtube")
 *     .language("en")
 *     .buffer(new SlidingWindowBuffer(window, interval, Duration.ZERO, clock))
 *     .maxQueuedSegments(16)
 *     .transcriptionClient(client)
 *     .analyzer(analyzer)
 *     .sink(sink)
 *     .drainExecutor(executor)
 *     .metrics(metrics)
 *     .clock(clock)
 *     .onSinkFailure(session::close)
 *     .build();
 * }</pre>
 */
public final class StreamProcessorBuilder {

    String sessionId;
    String platform = "unknown";
    String language = "en";
    SlidingWindowBuffer buffer;
    int maxQueuedSegments = 16;
    TranscriptionClient transcriptionClient;
    CredibilityAnalyzer analyzer;
    LiveSessionSink sink;
    Executor drainExecutor;
    PipelineMetrics metrics;
    Clock clock = Clock.systemUTC();
    Runnable sinkFailureHandler = () -> { };

    private StreamProcessorBuilder() {
    }

    public static StreamProcessorBuilder builder() {
        return new StreamProcessorBuilder();
    }

    public StreamProcessorBuilder sessionId(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public StreamProcessorBuilder platform(String platform) {
        this.platform = platform;
        return this;
    }

    public StreamProcessorBuilder language(String language) {
        this.language = language;
        return this;
    }

    public StreamProcessorBuilder buffer(SlidingWindowBuffer buffer) {
        this.buffer = buffer;
        return this;
    }

    public StreamProcessorBuilder maxQueuedSegments(int maxQueuedSegments) {
        this.maxQueuedSegments = maxQueuedSegments;
        return this;
    }

    public StreamProcessorBuilder transcriptionClient(TranscriptionClient transcriptionClient) {
        this.transcriptionClient = transcriptionClient;
        return this;
    }

    public StreamProcessorBuilder analyzer(CredibilityAnalyzer analyzer) {
        this.analyzer = analyzer;
        return this;
    }

    public StreamProcessorBuilder sink(LiveSessionSink sink) {
        this.sink = sink;
        return this;
    }

    public StreamProcessorBuilder drainExecutor(Executor drainExecutor) {
        this.drainExecutor = drainExecutor;
        return this;
    }

    public StreamProcessorBuilder metrics(PipelineMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public StreamProcessorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Callback run (outside the processor lock) when the sink rejects a message.
     */
    public StreamProcessorBuilder onSinkFailure(Runnable sinkFailureHandler) {
        this.sinkFailureHandler = sinkFailureHandler;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     * @throws IllegalArgumentException if {@code maxQueuedSegments} is not positive
     */
    public StreamProcessor build() {
        Objects.requireNonNull(sessionId, "sessionId is required");
        Objects.requireNonNull(platform, "platform is required");
        Objects.requireNonNull(language, "language is required");
        Objects.requireNonNull(buffer, "buffer is required");
        Objects.requireNonNull(transcriptionClient, "transcriptionClient is required");
        Objects.requireNonNull(analyzer, "analyzer is required");
        Objects.requireNonNull(sink, "sink is required");
        Objects.requireNonNull(drainExecutor, "drainExecutor is required");
        Objects.requireNonNull(metrics, "metrics is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(sinkFailureHandler, "sinkFailureHandler is required");
        if (maxQueuedSegments < 1) {
            throw new IllegalArgumentException("maxQueuedSegments must be positive, got: " + maxQueuedSegments);
        }
        return new StreamProcessor(this);
    }
}
