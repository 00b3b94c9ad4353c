package com.nicolaswinsten.semantle.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.nicolaswinsten.semantle.game.AttemptResult;
import com.nicolaswinsten.semantle.game.GameService;
import com.nicolaswinsten.semantle.game.GuessEvaluator;
import com.nicolaswinsten.semantle.stats.PlayerStats;
import com.nicolaswinsten.semantle.stats.StatsService;

/**
 * REST surface of the game.
 *
 * <table>
 *   <tr><th>Endpoint</th><th>Purpose</th></tr>
 *   <tr><td>{@code POST /api/game/new}</td><td>start a random or daily game</td></tr>
 *   <tr><td>{@code POST /api/game/guess}</td><td>score a guess</td></tr>
 *   <tr><td>{@code GET /api/game/{sessionId}}</td><td>read a session</td></tr>
 *   <tr><td>{@code GET /api/words/validate/{word}}</td><td>vocabulary membership</td></tr>
 *   <tr><td>{@code POST|GET /api/stats/{userId}}</td><td>record a game / read player stats</td></tr>
 * </table>
 *
 * Errors are translated by {@link GlobalExceptionHandler}.
 */
@RestController
public class GameController {
    private static final Logger LOGGER = LoggerFactory.getLogger(GameController.class);

    private final GameService gameService;
    private final GuessEvaluator guessEvaluator;
    private final StatsService statsService;

    public GameController(GameService gameService, GuessEvaluator guessEvaluator, StatsService statsService) {
        this.gameService = gameService;
        this.guessEvaluator = guessEvaluator;
        this.statsService = statsService;
    }

    /**
     * Starts a new game. The body is optional; without it a random (non-daily) game starts.
     *
     * @param debug when true the response includes the target word
     */
    @PostMapping("/api/game/new")
    public SessionView newGame(@RequestBody(required = false) NewGameRequest request,
                               @RequestParam(name = "debug", defaultValue = "false") boolean debug) {
        boolean daily = request != null && Boolean.TRUE.equals(request.daily());
        return SessionView.of(gameService.newGame(daily), debug);
    }

    @PostMapping("/api/game/guess")
    public GuessResponse guess(@Valid @RequestBody GuessRequest request) {
        AttemptResult result = guessEvaluator.submitGuess(request.sessionId(), request.word());
        return GuessResponse.of(result);
    }

    @GetMapping("/api/game/{sessionId}")
    public SessionView session(@PathVariable String sessionId,
                               @RequestParam(name = "debug", defaultValue = "false") boolean debug) {
        return SessionView.of(gameService.session(sessionId), debug);
    }

    @GetMapping("/api/words/validate/{word}")
    public ValidateResponse validate(@PathVariable String word) {
        return new ValidateResponse(gameService.isValidWord(word), word);
    }

    @PostMapping("/api/stats/{userId}")
    public PlayerStats recordGame(@PathVariable String userId, @Valid @RequestBody RecordGameRequest request) {
        LOGGER.debug("Recording game: userId={}, sessionId={}", userId, request.sessionId());
        return statsService.recordGame(userId, request.sessionId());
    }

    @GetMapping("/api/stats/{userId}")
    public PlayerStats stats(@PathVariable String userId) {
        return statsService.stats(userId);
    }

    // ── DTOs (deserialized from / serialized to JSON by Spring) ──────────────

    /** Body of {@code POST /api/game/new}. */
    public record NewGameRequest(@JsonProperty("daily") Boolean daily) {}

    /** Body of {@code POST /api/game/guess}. A blank word is scored as an invalid word, not a bad request. */
    public record GuessRequest(
        @JsonProperty("session_id") @NotBlank String sessionId,
        @JsonProperty("word") @NotNull String word
    ) {}

    public record GuessResponse(
        @JsonProperty("similarity") double similarity,
        @JsonProperty("rank") int rank,
        @JsonProperty("is_correct") boolean correct,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("attempts") int attempts
    ) {
        static GuessResponse of(AttemptResult result) {
            return new GuessResponse(result.similarity(), result.rank(), result.correct(), result.sessionId(), result.attempts());
        }
    }

    public record ValidateResponse(@JsonProperty("valid") boolean valid, @JsonProperty("word") String word) {}

    /** Body of {@code POST /api/stats/{userId}}. */
    public record RecordGameRequest(@JsonProperty("session_id") @NotBlank String sessionId) {}
}
