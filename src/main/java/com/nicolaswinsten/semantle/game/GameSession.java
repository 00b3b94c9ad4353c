package com.nicolaswinsten.semantle.game;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Live state of one game. Not thread-safe on its own: every access goes through
 * {@link SessionStore}, which holds the session's lock.
 */
public final class GameSession {

    private final String sessionId;
    private final String targetWord;
    private final float[] targetVector;
    private final boolean daily;
    private final Instant createdAt;
    private final List<Attempt> attempts = new ArrayList<>();
    private boolean completed;
    /** Built on the first guess and kept for the session's lifetime. */
    private Ranking ranking;

    GameSession(String sessionId, String targetWord, float[] targetVector, boolean daily, Instant createdAt) {
        this.sessionId = sessionId;
        this.targetWord = targetWord;
        this.targetVector = targetVector;
        this.daily = daily;
        this.createdAt = createdAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public String targetWord() {
        return targetWord;
    }

    float[] targetVector() {
        return targetVector;
    }

    public boolean isDaily() {
        return daily;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isCompleted() {
        return completed;
    }

    public int attemptCount() {
        return attempts.size();
    }

    boolean hasGuessed(String word) {
        for (Attempt attempt : attempts) {
            if (attempt.word().equals(word)) {
                return true;
            }
        }
        return false;
    }

    Ranking ranking() {
        return ranking;
    }

    void cacheRanking(Ranking ranking) {
        this.ranking = ranking;
    }

    /** Appends an attempt; a correct attempt completes the session in the same step. */
    void record(Attempt attempt) {
        if (completed) {
            throw new IllegalStateException("Session " + sessionId + " is already completed");
        }
        attempts.add(attempt);
        if (attempt.correct()) {
            completed = true;
        }
    }

    GameSnapshot snapshot() {
        return new GameSnapshot(sessionId, targetWord, daily, createdAt, List.copyOf(attempts), completed);
    }
}
