package com.nicolaswinsten.semantle.exception;

/**
 * Base exception for all game engine errors.
 *
 * <p>Every subclass carries a stable {@link #getErrorCode() error code} that the HTTP and
 * STOMP layers hand to clients unchanged. Messages must never contain a session's target word.
 */
public abstract class SemantleException extends RuntimeException {

    protected SemantleException(String message) {
        super(message);
    }

    protected SemantleException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable, client-facing code such as {@code InvalidWord} or {@code SessionNotFound}. */
    public abstract String getErrorCode();
}
