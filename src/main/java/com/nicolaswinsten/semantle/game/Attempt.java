package com.nicolaswinsten.semantle.game;

import java.time.Instant;

/**
 * One accepted guess, immutable once appended.
 *
 * @param word       normalized guess
 * @param similarity cosine similarity to the target, in [-1, 1]
 * @param rank       1-based position in the target's ranking
 * @param correct    whether the guess is the target
 * @param timestamp  when the guess was scored
 */
public record Attempt(String word, double similarity, int rank, boolean correct, Instant timestamp) {}
