package com.phillippitts.truthtell.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Audio producer settings ({@code audio.source.*}).
 *
 * <p>Each read from the producer's stdout becomes one chunk of at most {@code read-buffer-bytes}
 * bytes and is credited with {@code chunk-duration} of audio.
 */
@Validated
@ConfigurationProperties(prefix = "audio.source")
public class AudioSourceProperties {

    /** yt-dlp executable, resolved against PATH when not absolute. */
    @NotBlank
    private String binary = "yt-dlp";

    @NotBlank
    private String audioFormat = "mp3";

    @Min(1024)
    private int readBufferBytes = 16 * 1024;

    @NotNull
    private Duration chunkDuration = Duration.ofSeconds(1);

    /** Upper bound for a recorded (non-live) download. */
    @Min(1)
    private long maxDownloadBytes = 200L * 1024 * 1024;

    @NotNull
    private Duration downloadTimeout = Duration.ofMinutes(10);

    public String getBinary() {
        return binary;
    }

    public void setBinary(String binary) {
        this.binary = binary;
    }

    public String getAudioFormat() {
        return audioFormat;
    }

    public void setAudioFormat(String audioFormat) {
        this.audioFormat = audioFormat;
    }

    public int getReadBufferBytes() {
        return readBufferBytes;
    }

    public void setReadBufferBytes(int readBufferBytes) {
        this.readBufferBytes = readBufferBytes;
    }

    public Duration getChunkDuration() {
        return chunkDuration;
    }

    public void setChunkDuration(Duration chunkDuration) {
        this.chunkDuration = chunkDuration;
    }

    public long getMaxDownloadBytes() {
        return maxDownloadBytes;
    }

    public void setMaxDownloadBytes(long maxDownloadBytes) {
        this.maxDownloadBytes = maxDownloadBytes;
    }

    public Duration getDownloadTimeout() {
        return downloadTimeout;
    }

    public void setDownloadTimeout(Duration downloadTimeout) {
        this.downloadTimeout = downloadTimeout;
    }
}
