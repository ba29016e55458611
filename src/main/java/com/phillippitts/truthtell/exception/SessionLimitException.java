package com.phillippitts.truthtell.exception;

/**
 * Thrown when a live session is requested while {@code live.max-sessions} sessions are running.
 */
public class SessionLimitException extends TruthTellException {

    private final int maxSessions;

    public SessionLimitException(int maxSessions) {
        super("Live session limit reached (max " + maxSessions + ")");
        this.maxSessions = maxSessions;
    }

    public int getMaxSessions() {
        return maxSessions;
    }
}
