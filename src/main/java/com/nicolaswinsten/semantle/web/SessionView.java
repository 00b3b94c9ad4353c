package com.nicolaswinsten.semantle.web;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import com.nicolaswinsten.semantle.game.Attempt;
import com.nicolaswinsten.semantle.game.GameSnapshot;

/**
 * JSON view of a session for {@code POST /api/game/new} and {@code GET /api/game/{id}}.
 *
 * <p>{@code target_word} is only filled in when the caller asked for debug output or the game
 * is already won.
 */
public record SessionView(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("target_word") String targetWord,
    @JsonProperty("daily_word") boolean dailyWord,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("attempts") List<AttemptView> attempts,
    @JsonProperty("is_completed") boolean completed
) {

    static SessionView of(GameSnapshot session, boolean debug) {
        String target = debug || session.completed() ? session.targetWord() : null;
        List<AttemptView> attempts = session.attempts().stream().map(AttemptView::of).toList();
        return new SessionView(session.sessionId(), target, session.daily(), session.createdAt(), attempts, session.completed());
    }

    public record AttemptView(
        @JsonProperty("word") String word,
        @JsonProperty("similarity") double similarity,
        @JsonProperty("rank") int rank,
        @JsonProperty("is_correct") boolean correct,
        @JsonProperty("timestamp") Instant timestamp
    ) {
        static AttemptView of(Attempt attempt) {
            return new AttemptView(attempt.word(), attempt.similarity(), attempt.rank(), attempt.correct(), attempt.timestamp());
        }
    }
}
