package com.nicolaswinsten.semantle.web;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.nicolaswinsten.semantle.exception.DuplicateGuessException;
import com.nicolaswinsten.semantle.exception.EmbeddingProviderException;
import com.nicolaswinsten.semantle.exception.InvalidWordException;
import com.nicolaswinsten.semantle.exception.SemantleException;
import com.nicolaswinsten.semantle.exception.SessionAlreadyCompletedException;
import com.nicolaswinsten.semantle.exception.SessionNotFoundException;

/**
 * Converts engine exceptions to HTTP responses carrying the stable error code.
 *
 * <p>Bodies never include internal details; in particular no message names a target word.
 */
@RestControllerAdvice
class GlobalExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String INVALID_REQUEST = "InvalidRequest";

    /**
     * Client error - word missing from the vocabulary (HTTP 400).
     */
    @ExceptionHandler(InvalidWordException.class)
    ResponseEntity<ApiError> handleInvalidWord(InvalidWordException ex) {
        LOGGER.debug("Invalid word rejected: {}", ex.getWord());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid word or word not in vocabulary");
    }

    /**
     * Unknown or expired session - client should start a new game (HTTP 404).
     */
    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOGGER.info("Session not found: sessionId={}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex, "Session not found");
    }

    /**
     * Stale client state (HTTP 409).
     */
    @ExceptionHandler(SessionAlreadyCompletedException.class)
    ResponseEntity<ApiError> handleAlreadyCompleted(SessionAlreadyCompletedException ex) {
        return error(HttpStatus.CONFLICT, ex, "Game already completed");
    }

    @ExceptionHandler(DuplicateGuessException.class)
    ResponseEntity<ApiError> handleDuplicate(DuplicateGuessException ex) {
        return error(HttpStatus.CONFLICT, ex, "Word already guessed");
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(EmbeddingProviderException.class)
    ResponseEntity<ApiError> handleProvider(EmbeddingProviderException ex) {
        LOGGER.error("Embedding provider failed: provider={}", ex.getProviderName(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Embedding service temporarily unavailable, please retry");
    }

    /**
     * Malformed JSON, unknown fields, failed bean validation or an unparseable path/query
     * parameter (HTTP 400).
     */
    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentNotValidException.class,
        TypeMismatchException.class
    })
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOGGER.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(INVALID_REQUEST, "Malformed or incomplete request", Instant.now()));
    }

    /**
     * Catch-all. Framework errors keep their own status (404 for unknown paths, 405, ...);
     * anything else is HTTP 500.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse frameworkError) {
            HttpStatusCode status = frameworkError.getStatusCode();
            return ResponseEntity.status(status)
                .body(new ApiError(INVALID_REQUEST, "Request could not be handled", Instant.now()));
        }
        LOGGER.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError("InternalServerError", "An unexpected error occurred", Instant.now()));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, SemantleException ex, String message) {
        return ResponseEntity.status(status).body(new ApiError(ex.getErrorCode(), message, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("message") String message,
        @JsonProperty("timestamp") Instant timestamp
    ) {}
}
