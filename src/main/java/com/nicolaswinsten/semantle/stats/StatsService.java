package com.nicolaswinsten.semantle.stats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nicolaswinsten.semantle.exception.SessionNotFoundException;
import com.nicolaswinsten.semantle.game.GameSnapshot;
import com.nicolaswinsten.semantle.game.SessionStore;

/**
 * Per-player game statistics, kept in memory.
 *
 * <p>Player ids are opaque and not verified. Records are built from the server-side session, so a
 * client can only report which session it played, not how it went. A player untouched for
 * longer than the ledger TTL is dropped by {@link #evictIdle(Duration)}.
 */
public class StatsService {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatsService.class);

    static final int HISTORY_LIMIT = 100;
    static final int HISTORY_VIEW = 20;

    private final ConcurrentMap<String, Ledger> ledgers = new ConcurrentHashMap<>();
    private final SessionStore sessionStore;
    private final Clock clock;

    public StatsService(SessionStore sessionStore, Clock clock) {
        this.sessionStore = sessionStore;
        this.clock = clock;
    }

    /**
     * Adds the session to the player's history. Recording the same session twice is a no-op.
     *
     * @throws SessionNotFoundException if the session is unknown or expired
     */
    public PlayerStats recordGame(String userId, String sessionId) {
        GameSnapshot session = sessionStore.get(sessionId);
        // an unfinished game keeps its target hidden
        String target = session.completed() ? session.targetWord() : null;
        GameRecord record = new GameRecord(session.sessionId(), target, session.attempts().size(),
            session.completed(), session.daily(), clock.instant());
        while (true) {
            Ledger ledger = ledgers.computeIfAbsent(userId, k -> new Ledger());
            synchronized (ledger) {
                if (ledger.evicted) {
                    continue;
                }
                ledger.lastAccess = clock.instant();
                if (ledger.add(record)) {
                    LOGGER.info("Game recorded: userId={}, sessionId={}, completed={}", userId, sessionId, record.completed());
                }
                return ledger.view();
            }
        }
    }

    public PlayerStats stats(String userId) {
        Ledger ledger = ledgers.get(userId);
        if (ledger == null) {
            return PlayerStats.empty();
        }
        synchronized (ledger) {
            if (ledger.evicted) {
                return PlayerStats.empty();
            }
            ledger.lastAccess = clock.instant();
            return ledger.view();
        }
    }

    /**
     * Drops players whose ledger was not read or written for longer than {@code ttl}.
     *
     * @return number of players dropped
     */
    public int evictIdle(Duration ttl) {
        Instant cutoff = clock.instant().minus(ttl);
        int evicted = 0;
        for (Map.Entry<String, Ledger> entry : ledgers.entrySet()) {
            Ledger ledger = entry.getValue();
            synchronized (ledger) {
                if (ledger.lastAccess.isBefore(cutoff)) {
                    ledger.evicted = true;
                    ledgers.remove(entry.getKey(), ledger);
                    evicted++;
                }
            }
        }
        return evicted;
    }

    int playerCount() {
        return ledgers.size();
    }

    /** Mutable per-player totals; guarded by its own monitor. */
    private static final class Ledger {
        Instant lastAccess = Instant.MIN;
        boolean evicted;
        int totalGames;
        int completedGames;
        int totalAttempts;
        final Deque<GameRecord> history = new ArrayDeque<>();

        boolean add(GameRecord record) {
            for (GameRecord existing : history) {
                if (existing.sessionId().equals(record.sessionId())) {
                    return false;
                }
            }
            totalGames++;
            if (record.completed()) {
                completedGames++;
                totalAttempts += record.attempts();
            }
            history.addLast(record);
            while (history.size() > HISTORY_LIMIT) {
                history.removeFirst();
            }
            return true;
        }

        PlayerStats view() {
            double average = completedGames > 0
                ? Math.round((double) totalAttempts / completedGames * 100.0) / 100.0
                : 0;
            int best = 0;
            for (GameRecord r : history) {
                if (r.completed() && (best == 0 || r.attempts() < best)) {
                    best = r.attempts();
                }
            }
            List<GameRecord> all = new ArrayList<>(history);
            List<GameRecord> recent = all.subList(Math.max(0, all.size() - HISTORY_VIEW), all.size());
            return new PlayerStats(totalGames, completedGames, average, best, List.copyOf(recent));
        }
    }
}
