package com.nicolaswinsten.semantle.stats;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Aggregated statistics for one player.
 *
 * @param averageAttempts mean attempts over completed games, rounded to 2 decimals
 * @param bestScore       fewest attempts among completed games in the kept history, 0 when none
 * @param gamesHistory    most recent games, oldest first
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerStats(
    int totalGames,
    int completedGames,
    double averageAttempts,
    int bestScore,
    List<GameRecord> gamesHistory
) {
    public static PlayerStats empty() {
        return new PlayerStats(0, 0, 0, 0, List.of());
    }
}
