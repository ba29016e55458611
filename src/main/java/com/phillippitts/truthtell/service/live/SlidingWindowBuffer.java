package com.phillippitts.truthtell.service.live;

import com.phillippitts.truthtell.domain.AudioSegment;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Time-bounded window of audio chunks for one live session.
 *
 * <p><b>Window:</b> chunks are kept in arrival order with a running sum of their declared
 * durations. After every {@link #addChunk} the oldest chunks are evicted while the sum exceeds
 * the maximum window, so the sum never exceeds it once the call returns.
 *
 * <p><b>Flush readiness</b> is wall-clock based: a flush is due once {@code minFlushInterval} has
 * elapsed since the last flush (or since construction), independent of how much audio arrived.
 * {@code minSegmentDuration} additionally holds the flush back until that much audio is
 * buffered; zero disables the check.
 *
 * <p><b>Flush transaction:</b> {@link #getBuffer()} returns the concatenated payload and records
 * the flush time but keeps the chunks; callers must {@link #clear()} after dispatching the bytes,
 * otherwise they will be returned again by the next flush.
 *
 * <p><b>Thread Safety:</b> not thread-safe. Owned and guarded by a single {@link StreamProcessor}.
 */
public final class SlidingWindowBuffer {

    private final Duration maxWindow;
    private final Duration minFlushInterval;
    private final Duration minSegmentDuration;
    private final Clock clock;

    private final Deque<AudioSegment> segments = new ArrayDeque<>();
    private Duration totalDuration = Duration.ZERO;
    private Instant lastFlushAt;

    public SlidingWindowBuffer(Duration maxWindow, Duration minFlushInterval, Duration minSegmentDuration, Clock clock) {
        this.maxWindow = requirePositive(maxWindow, "maxWindow");
        this.minFlushInterval = requireNonNegative(minFlushInterval, "minFlushInterval");
        this.minSegmentDuration = requireNonNegative(minSegmentDuration, "minSegmentDuration");
        if (minSegmentDuration.compareTo(maxWindow) > 0) {
            throw new IllegalArgumentException("minSegmentDuration must not exceed maxWindow");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.lastFlushAt = clock.instant();
    }

    /**
     * Appends a chunk, evicts the oldest chunks while the window is over its maximum,
     * and reports whether a flush is due.
     *
     * @param payload chunk bytes (must not be null)
     * @param duration declared chunk duration (must not be negative)
     * @return {@code true} if the caller should flush now
     */
    public boolean addChunk(byte[] payload, Duration duration) {
        Instant now = clock.instant();
        AudioSegment segment = new AudioSegment(payload, duration, now);
        segments.addLast(segment);
        totalDuration = totalDuration.plus(duration);

        while (totalDuration.compareTo(maxWindow) > 0 && !segments.isEmpty()) {
            AudioSegment evicted = segments.removeFirst();
            totalDuration = totalDuration.minus(evicted.duration());
        }
        return isFlushDue(now);
    }

    private boolean isFlushDue(Instant now) {
        if (segments.isEmpty()) {
            return false;
        }
        boolean intervalElapsed = Duration.between(lastFlushAt, now).compareTo(minFlushInterval) >= 0;
        return intervalElapsed && totalDuration.compareTo(minSegmentDuration) >= 0;
    }

    /**
     * Concatenates every held chunk in arrival order and records the flush time.
     * Does not clear the window.
     *
     * @return concatenated payload, empty when no chunks are held
     */
    public byte[] getBuffer() {
        lastFlushAt = clock.instant();
        if (segments.isEmpty()) {
            return new byte[0];
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(byteCount());
        for (AudioSegment segment : segments) {
            out.writeBytes(segment.payload());
        }
        return out.toByteArray();
    }

    /**
     * Releases every held chunk and resets the running duration.
     */
    public void clear() {
        segments.clear();
        totalDuration = Duration.ZERO;
    }

    public Duration totalDuration() {
        return totalDuration;
    }

    public int segmentCount() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public Instant lastFlushAt() {
        return lastFlushAt;
    }

    public Duration maxWindow() {
        return maxWindow;
    }

    private int byteCount() {
        long total = 0;
        for (AudioSegment segment : segments) {
            total += segment.payload().length;
        }
        return (int) Math.min(total, Integer.MAX_VALUE - 8);
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + d);
        }
        return d;
    }

    private static Duration requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + d);
        }
        return d;
    }
}
