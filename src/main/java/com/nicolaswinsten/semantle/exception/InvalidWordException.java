package com.nicolaswinsten.semantle.exception;

/**
 * Thrown when a guess is blank or not part of the vocabulary. No session state changes.
 */
public class InvalidWordException extends SemantleException {

    private final String word;

    public InvalidWordException(String word) {
        super("Invalid word or word not in vocabulary: '" + word + "'");
        this.word = word;
    }

    public String getWord() {
        return word;
    }

    @Override
    public String getErrorCode() {
        return "InvalidWord";
    }
}
