package com.phillippitts.truthtell.exception;

/**
 * Thrown when a client request is missing required fields or carries malformed values.
 */
public class InvalidRequestException extends TruthTellException {

    private final String field;

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
