package com.phillippitts.truthtell.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The transcription pool runs the drain loops of all live sessions; each session occupies
 * at most one thread at a time while it drains. The pool's maximum size is
 * {@code live.max-sessions}, see {@link LiveStreamProperties#getMaxSessions()}.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private TranscriptionPoolProperties transcription = new TranscriptionPoolProperties();

    public TranscriptionPoolProperties getTranscription() {
        return transcription;
    }

    public void setTranscription(TranscriptionPoolProperties transcription) {
        this.transcription = transcription;
    }

    /**
     * Transcription executor pool configuration.
     */
    public static class TranscriptionPoolProperties {
        @Min(1)
        private int corePoolSize = 4;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "transcription-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
