package com.nicolaswinsten.semantle.exception;

/**
 * Thrown when the vocabulary source is malformed: duplicate words after normalization,
 * mismatched vector dimensionality, an empty word set, or an unreadable file.
 * Fatal at start-up.
 */
public class VocabularyLoadException extends SemantleException {

    public VocabularyLoadException(String message) {
        super(message);
    }

    public VocabularyLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "LoadError";
    }
}
