package com.phillippitts.truthtell.exception;

/**
 * Thrown when a message cannot be delivered to the live client connection.
 * A sink failure ends the session.
 */
public class SinkException extends TruthTellException {

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
