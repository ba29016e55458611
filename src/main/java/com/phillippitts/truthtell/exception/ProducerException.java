package com.phillippitts.truthtell.exception;

/**
 * Thrown when the audio producer for a source fails to start, exits abnormally,
 * or cannot be read.
 */
public class ProducerException extends TruthTellException {

    private final String sourceId;

    public ProducerException(String message, String sourceId) {
        super(message + " (source: " + sourceId + ")");
        this.sourceId = sourceId;
    }

    public ProducerException(String message, String sourceId, Throwable cause) {
        super(message + " (source: " + sourceId + ")", cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
