package com.phillippitts.truthtell.exception;

/**
 * Thrown when the external transcription call fails, times out, or returns no text.
 */
public class TranscriptionException extends TruthTellException {

    private final String provider;

    public TranscriptionException(String message) {
        super(message);
        this.provider = "unknown";
    }

    public TranscriptionException(String message, String provider) {
        super(message + " (provider: " + provider + ")");
        this.provider = provider;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.provider = "unknown";
    }

    public TranscriptionException(String message, String provider, Throwable cause) {
        super(message + " (provider: " + provider + ")", cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
