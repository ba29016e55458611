package com.phillippitts.truthtell.exception;

/**
 * Thrown when credibility scoring of a text fails. Scoring works on plain text without I/O,
 * so this is treated as unrecoverable for the segment that caused it.
 */
public class AnalysisException extends TruthTellException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
