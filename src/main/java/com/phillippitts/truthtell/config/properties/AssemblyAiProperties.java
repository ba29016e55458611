package com.phillippitts.truthtell.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * AssemblyAI REST settings ({@code transcription.assemblyai.*}).
 *
 * <p>The API key is normally supplied through the {@code ASSEMBLYAI_API_KEY} environment
 * variable (see application.properties).
 */
@Validated
@ConfigurationProperties(prefix = "transcription.assemblyai")
public class AssemblyAiProperties {

    @NotBlank
    private String baseUrl = "https://api.assemblyai.com";

    private String apiKey = "";

    /** Delay between transcript status polls. */
    @NotNull
    private Duration pollInterval = Duration.ofSeconds(1);

    /** Upper bound for one transcript to complete, measured from submission. */
    @NotNull
    private Duration timeout = Duration.ofMinutes(2);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
