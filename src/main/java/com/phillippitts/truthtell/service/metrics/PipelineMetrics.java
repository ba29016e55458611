package com.phillippitts.truthtell.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the live ingestion pipeline and the credibility analyzer.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Segments flushed and segments dropped by the full-queue policy</li>
 *   <li>Transcription latency and success/failure counts</li>
 *   <li>Analysis cache hits and misses, verdict distribution</li>
 *   <li>Messages the sink could not deliver</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "truthtell";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementSegmentsFlushed() {
        Counter.builder(METRIC_PREFIX + ".segments.flushed")
                .description("Number of buffer flushes enqueued for transcription")
                .register(registry)
                .increment();
    }

    public void incrementSegmentsDropped() {
        Counter.builder(METRIC_PREFIX + ".segments.dropped")
                .description("Number of pending segments dropped because the queue was full")
                .register(registry)
                .increment();
    }

    /**
     * Records the latency of one upload + transcribe round trip.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordTranscriptionLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken to upload and transcribe one segment")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementTranscriptionSuccess() {
        Counter.builder(METRIC_PREFIX + ".transcription.success")
                .description("Number of segments transcribed and analyzed")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure class (transcription, analysis, unexpected)
     */
    public void incrementTranscriptionFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".transcription.failure")
                .description("Number of segments that produced an error message")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementCacheHit() {
        Counter.builder(METRIC_PREFIX + ".analysis.cache")
                .description("Analysis cache lookups")
                .tag("result", "hit")
                .register(registry)
                .increment();
    }

    public void incrementCacheMiss() {
        Counter.builder(METRIC_PREFIX + ".analysis.cache")
                .description("Analysis cache lookups")
                .tag("result", "miss")
                .register(registry)
                .increment();
    }

    /**
     * @param verdict verdict label of a freshly computed analysis
     */
    public void recordVerdict(String verdict) {
        Counter.builder(METRIC_PREFIX + ".analysis.verdict")
                .description("Computed analyses by verdict")
                .tag("verdict", verdict)
                .register(registry)
                .increment();
    }

    public void incrementSinkFailure() {
        Counter.builder(METRIC_PREFIX + ".sink.failure")
                .description("Messages that could not be delivered to a live client")
                .register(registry)
                .increment();
    }
}
