package com.nicolaswinsten.semantle.game;

/**
 * What a guess returns to the caller.
 *
 * @param sessionId session the guess was scored in
 * @param word      normalized guess
 * @param attempts  number of attempts in the session after this one
 */
public record AttemptResult(String sessionId, String word, double similarity, int rank, boolean correct, int attempts) {}
