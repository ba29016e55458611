package com.phillippitts.truthtell.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Expiring cache settings ({@code cache.*}).
 *
 * <p>The sweep schedule itself is bound from {@code cache.sweep-interval-ms} by
 * {@link com.phillippitts.truthtell.service.cache.CacheSweeper}.
 */
@Validated
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    /** How long downloaded audio stays staged in the AUDIO namespace. */
    @NotNull
    private Duration audioTtl = Duration.ofMinutes(10);

    public Duration getAudioTtl() {
        return audioTtl;
    }

    public void setAudioTtl(Duration audioTtl) {
        this.audioTtl = audioTtl;
    }
}
