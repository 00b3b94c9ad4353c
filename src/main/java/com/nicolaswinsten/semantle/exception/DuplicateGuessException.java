package com.nicolaswinsten.semantle.exception;

/**
 * Thrown when duplicate rejection is enabled and the word was already guessed in the session.
 */
public class DuplicateGuessException extends SemantleException {

    public DuplicateGuessException(String word) {
        super("Word already guessed: '" + word + "'");
    }

    @Override
    public String getErrorCode() {
        return "DuplicateGuess";
    }
}
