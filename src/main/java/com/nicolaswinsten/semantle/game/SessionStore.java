package com.nicolaswinsten.semantle.game;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nicolaswinsten.semantle.exception.SessionNotFoundException;

/**
 * Owns every live {@link GameSession}, keyed by session id.
 *
 * <h3>Locking</h3>
 * Each session sits in its own {@link Slot} with its own lock. Reads and updates of one session
 * are serialized; different sessions never contend. The map itself is only used for lookup,
 * insertion and eviction.
 *
 * <p>Nothing is persisted. Sessions disappear on eviction or restart, which callers observe as
 * {@link SessionNotFoundException}.
 */
public class SessionStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionStore.class);

    private final ConcurrentMap<String, Slot> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionStore(Clock clock) {
        this.clock = clock;
    }

    /** Stores a fresh session with no attempts and returns its snapshot. */
    public GameSnapshot create(String targetWord, float[] targetVector, boolean daily) {
        Instant now = clock.instant();
        String sessionId;
        Slot slot;
        do {
            sessionId = UUID.randomUUID().toString();
            slot = new Slot(new GameSession(sessionId, targetWord, targetVector, daily, now), now);
        } while (sessions.putIfAbsent(sessionId, slot) != null);
        return slot.session.snapshot();
    }

    /**
     * @throws SessionNotFoundException if no live session has this id
     */
    public GameSnapshot get(String sessionId) {
        return update(sessionId, GameSession::snapshot);
    }

    /**
     * Runs {@code mutator} while holding the session's lock. Exceptions thrown by the mutator
     * propagate unchanged; the mutator is responsible for validating before it mutates.
     *
     * @throws SessionNotFoundException if no live session has this id, or it was evicted while waiting
     */
    public <T> T update(String sessionId, Function<GameSession, T> mutator) {
        Slot slot = sessionId == null ? null : sessions.get(sessionId);
        if (slot == null) {
            throw new SessionNotFoundException(sessionId);
        }
        slot.lock.lock();
        try {
            if (slot.evicted) {
                throw new SessionNotFoundException(sessionId);
            }
            slot.lastAccess = clock.instant();
            return mutator.apply(slot.session);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Removes sessions idle for longer than {@code ttl}. Sessions whose lock is held right now
     * are in use and skipped.
     *
     * @return number of sessions evicted
     */
    public int evictIdle(Duration ttl) {
        Instant cutoff = clock.instant().minus(ttl);
        int evicted = 0;
        for (Map.Entry<String, Slot> entry : sessions.entrySet()) {
            Slot slot = entry.getValue();
            if (!slot.lock.tryLock()) {
                continue;
            }
            try {
                if (slot.lastAccess.isBefore(cutoff)) {
                    slot.evicted = true;
                    sessions.remove(entry.getKey(), slot);
                    evicted++;
                    LOGGER.debug("Session evicted: sessionId={}", entry.getKey());
                }
            } finally {
                slot.lock.unlock();
            }
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }

    private static final class Slot {
        final ReentrantLock lock = new ReentrantLock();
        final GameSession session;
        Instant lastAccess;
        boolean evicted;

        Slot(GameSession session, Instant lastAccess) {
            this.session = session;
            this.lastAccess = lastAccess;
        }
    }
}
