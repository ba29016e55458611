package com.phillippitts.truthtell.exception;

/**
 * Base exception for all TruthTell application-specific errors.
 * All domain exceptions extend this class so the live pipeline and the REST boundary
 * can handle them uniformly.
 */
public class TruthTellException extends RuntimeException {

    public TruthTellException(String message) {
        super(message);
    }

    public TruthTellException(String message, Throwable cause) {
        super(message, cause);
    }

    public TruthTellException(Throwable cause) {
        super(cause);
    }
}
