package com.nicolaswinsten.semantle.game;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of a session taken under its lock. Handed out instead of the live
 * {@link GameSession} so nothing outside the engine can mutate game state.
 */
public record GameSnapshot(
    String sessionId,
    String targetWord,
    boolean daily,
    Instant createdAt,
    List<Attempt> attempts,
    boolean completed
) {}
