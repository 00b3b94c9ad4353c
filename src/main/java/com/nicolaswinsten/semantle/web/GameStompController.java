package com.nicolaswinsten.semantle.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import com.nicolaswinsten.semantle.exception.SemantleException;
import com.nicolaswinsten.semantle.game.AttemptResult;
import com.nicolaswinsten.semantle.game.GuessEvaluator;

/**
 * Real-time guessing over STOMP. Runs the same transaction as {@code POST /api/game/guess}
 * and publishes the outcome to the session's topics.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li>Client subscribes to {@code /topic/game/{sessionId}/*} and sends {@code /app/guess}.</li>
 *   <li>A scored guess goes to {@code .../attempts}; a rejected one to {@code .../errors}
 *       with the same error code the REST API uses.</li>
 *   <li>The guess that finds the target also sends a {@code completed} status.</li>
 * </ol>
 * Frames without a session id or word are silently dropped.
 */
@Controller
public class GameStompController {
    private static final Logger LOGGER = LoggerFactory.getLogger(GameStompController.class);

    private final SimpMessagingTemplate messagingTemplate;
    private final GuessEvaluator guessEvaluator;

    public GameStompController(SimpMessagingTemplate messagingTemplate, GuessEvaluator guessEvaluator) {
        this.messagingTemplate = messagingTemplate;
        this.guessEvaluator = guessEvaluator;
    }

    @MessageMapping("/guess")
    public void guess(GuessFrame frame) {
        if (frame == null
                || frame.sessionId() == null
                || frame.sessionId().isBlank()
                || frame.word() == null) {
            return;
        }
        String sessionId = frame.sessionId().trim();
        String topic = "/topic/game/" + sessionId;

        AttemptResult result;
        try {
            result = guessEvaluator.submitGuess(sessionId, frame.word());
        } catch (SemantleException e) {
            LOGGER.debug("STOMP guess rejected: sessionId={}, errorCode={}", sessionId, e.getErrorCode());
            messagingTemplate.convertAndSend(topic + "/errors", new ErrorMessage(e.getErrorCode(), e.getMessage()));
            return;
        }

        messagingTemplate.convertAndSend(
            topic + "/attempts",
            new AttemptMessage(result.word(), result.similarity(), result.rank(), result.correct(), result.attempts())
        );
        if (result.correct()) {
            messagingTemplate.convertAndSend(
                topic + "/status",
                new StatusMessage(sessionId, GameStatus.COMPLETED, result.attempts())
            );
        }
    }

    // ── DTOs (deserialized from / serialized to JSON by Spring) ──────────────

    /** Payload received on {@code /app/guess}. */
    public record GuessFrame(@JsonProperty("session_id") String sessionId, @JsonProperty("word") String word) {}

    /** Broadcast to {@code /topic/game/{sessionId}/attempts}. */
    public record AttemptMessage(
        @JsonProperty("word") String word,
        @JsonProperty("similarity") double similarity,
        @JsonProperty("rank") int rank,
        @JsonProperty("is_correct") boolean correct,
        @JsonProperty("attempts") int attempts
    ) {}

    /** Broadcast to {@code /topic/game/{sessionId}/errors}. */
    public record ErrorMessage(@JsonProperty("error_code") String errorCode, @JsonProperty("message") String message) {}

    public enum GameStatus {
        COMPLETED("completed");

        private final String value;

        GameStatus(String value) { this.value = value; }

        @JsonValue
        public String getValue() { return value; }
    }

    /** Broadcast to {@code /topic/game/{sessionId}/status}. */
    public record StatusMessage(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("status") GameStatus status,
        @JsonProperty("attempts") int attempts
    ) {}
}
