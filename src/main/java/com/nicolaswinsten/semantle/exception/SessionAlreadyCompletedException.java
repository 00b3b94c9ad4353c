package com.nicolaswinsten.semantle.exception;

/**
 * Thrown when a guess arrives for a session whose target word has already been found.
 */
public class SessionAlreadyCompletedException extends SemantleException {

    private final String sessionId;

    public SessionAlreadyCompletedException(String sessionId) {
        super("Game already completed: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    public String getErrorCode() {
        return "SessionAlreadyCompleted";
    }
}
