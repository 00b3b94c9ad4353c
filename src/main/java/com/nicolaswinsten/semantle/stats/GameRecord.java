package com.nicolaswinsten.semantle.stats;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One finished or abandoned game in a player's history.
 *
 * @param targetWord the target, or {@code null} when the game was not completed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GameRecord(
    String sessionId,
    String targetWord,
    int attempts,
    boolean completed,
    @JsonProperty("daily_word") boolean daily,
    Instant date
) {}
