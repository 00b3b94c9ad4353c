package com.nicolaswinsten.semantle.game;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.nicolaswinsten.semantle.exception.SessionNotFoundException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStoreTest {

    private static final float[] VECTOR = {1f, 0f};

    private MutableClock clock;
    private SessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
        store = new SessionStore(clock);
    }

    // ── create / get ────────────────────────────────────────────────────────

    @Test
    void createdSessionStartsEmptyAndActive() {
        GameSnapshot session = store.create("cat", VECTOR, true);

        assertThat(session.sessionId()).isNotBlank();
        assertThat(session.targetWord()).isEqualTo("cat");
        assertThat(session.daily()).isTrue();
        assertThat(session.attempts()).isEmpty();
        assertThat(session.completed()).isFalse();
        assertThat(session.createdAt()).isEqualTo(clock.instant());
    }

    @Test
    void sessionIdsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(store.create("cat", VECTOR, false).sessionId());
        }
        assertThat(ids).hasSize(100);
        assertThat(store.size()).isEqualTo(100);
    }

    @Test
    void getReturnsStoredSession() {
        GameSnapshot created = store.create("cat", VECTOR, false);
        assertThat(store.get(created.sessionId())).isEqualTo(created);
    }

    @Test
    void unknownIdIsNotFound() {
        store.create("cat", VECTOR, false);
        assertThatThrownBy(() -> store.get("S2"))
            .isInstanceOf(SessionNotFoundException.class)
            .extracting(e -> ((SessionNotFoundException) e).getErrorCode())
            .isEqualTo("SessionNotFound");
    }

    @Test
    void nullIdIsNotFound() {
        assertThatThrownBy(() -> store.get(null)).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void snapshotIsNotAffectedByLaterUpdates() {
        GameSnapshot before = store.create("cat", VECTOR, false);
        store.update(before.sessionId(), s -> {
            s.record(new Attempt("dog", 0.9, 2, false, clock.instant()));
            return null;
        });

        assertThat(before.attempts()).isEmpty();
        assertThat(store.get(before.sessionId()).attempts()).hasSize(1);
    }

    // ── update ──────────────────────────────────────────────────────────────

    @Test
    void concurrentUpdatesToOneSessionAreNotLost() throws InterruptedException {
        String id = store.create("cat", VECTOR, false).sessionId();
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < perThread; i++) {
                        store.update(id, s -> {
                            s.record(new Attempt("dog", 0.9, 2, false, clock.instant()));
                            return null;
                        });
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
        assertThat(store.get(id).attempts()).hasSize(threads * perThread);
    }

    @Test
    void mutatorExceptionPropagates() {
        String id = store.create("cat", VECTOR, false).sessionId();
        assertThatThrownBy(() -> store.update(id, s -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        // lock was released
        assertThat(store.get(id).attempts()).isEmpty();
    }

    // ── eviction ────────────────────────────────────────────────────────────

    @Test
    void idleSessionsAreEvicted() {
        String idle = store.create("cat", VECTOR, false).sessionId();
        clock.advance(Duration.ofHours(2));
        String fresh = store.create("dog", VECTOR, false).sessionId();
        clock.advance(Duration.ofMinutes(30));

        int evicted = store.evictIdle(Duration.ofHours(1));

        assertThat(evicted).isEqualTo(1);
        assertThatThrownBy(() -> store.get(idle)).isInstanceOf(SessionNotFoundException.class);
        assertThat(store.get(fresh).targetWord()).isEqualTo("dog");
    }

    @Test
    void accessKeepsSessionAlive() {
        String id = store.create("cat", VECTOR, false).sessionId();
        clock.advance(Duration.ofMinutes(50));
        store.get(id);
        clock.advance(Duration.ofMinutes(50));

        assertThat(store.evictIdle(Duration.ofHours(1))).isZero();
        assertThat(store.get(id)).isNotNull();
    }
}
