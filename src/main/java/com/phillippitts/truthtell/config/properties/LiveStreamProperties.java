package com.phillippitts.truthtell.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Live session tuning ({@code live.*}).
 *
 * <ul>
 *   <li>{@code window} - maximum audio held by the sliding window (default 10s)</li>
 *   <li>{@code min-flush-interval} - wall-clock time between flushes (default 10s)</li>
 *   <li>{@code min-segment-duration} - minimum buffered audio for a flush, 0 disables (default 0)</li>
 *   <li>{@code max-queued-segments} - pending segments before the oldest is dropped (default 16)</li>
 *   <li>{@code max-sessions} - concurrent live sessions; also the maximum size of the
 *       transcription pool, one drain thread per session (default 32)</li>
 *   <li>{@code default-language} - used when {@code start_live} carries no language (default en)</li>
 *   <li>{@code allowed-origins} - origins accepted on {@code /ws/live} (default *)</li>
 *   <li>{@code send-time-limit}, {@code send-buffer-size-limit} - bounds for a slow client before
 *       its session is torn down</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "live")
public class LiveStreamProperties {

    @NotNull
    private Duration window = Duration.ofSeconds(10);

    @NotNull
    private Duration minFlushInterval = Duration.ofSeconds(10);

    @NotNull
    private Duration minSegmentDuration = Duration.ZERO;

    @Min(1)
    private int maxQueuedSegments = 16;

    @Min(1)
    private int maxSessions = 32;

    @NotBlank
    private String defaultLanguage = "en";

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    @NotNull
    private Duration sendTimeLimit = Duration.ofSeconds(10);

    @Min(1024)
    private int sendBufferSizeLimit = 512 * 1024;

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public Duration getMinFlushInterval() {
        return minFlushInterval;
    }

    public void setMinFlushInterval(Duration minFlushInterval) {
        this.minFlushInterval = minFlushInterval;
    }

    public Duration getMinSegmentDuration() {
        return minSegmentDuration;
    }

    public void setMinSegmentDuration(Duration minSegmentDuration) {
        this.minSegmentDuration = minSegmentDuration;
    }

    public int getMaxQueuedSegments() {
        return maxQueuedSegments;
    }

    public void setMaxQueuedSegments(int maxQueuedSegments) {
        this.maxQueuedSegments = maxQueuedSegments;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public void setMaxSessions(int maxSessions) {
        this.maxSessions = maxSessions;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public Duration getSendTimeLimit() {
        return sendTimeLimit;
    }

    public void setSendTimeLimit(Duration sendTimeLimit) {
        this.sendTimeLimit = sendTimeLimit;
    }

    public int getSendBufferSizeLimit() {
        return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }
}
