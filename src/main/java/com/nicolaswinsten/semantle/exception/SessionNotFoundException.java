package com.nicolaswinsten.semantle.exception;

/**
 * Thrown when a session id is unknown, for example because it expired or was issued by a
 * previous server process. Clients treat it as "start a new game".
 */
public class SessionNotFoundException extends SemantleException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    public String getErrorCode() {
        return "SessionNotFound";
    }
}
