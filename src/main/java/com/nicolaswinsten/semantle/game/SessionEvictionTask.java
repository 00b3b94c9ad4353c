package com.nicolaswinsten.semantle.game;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/** Periodically drops idle sessions from the {@link SessionStore}. */
public class SessionEvictionTask {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionEvictionTask.class);

    private final SessionStore sessionStore;
    private final Duration sessionTtl;

    public SessionEvictionTask(SessionStore sessionStore, Duration sessionTtl) {
        this.sessionStore = sessionStore;
        this.sessionTtl = sessionTtl;
    }

    @Scheduled(fixedDelayString = "${semantle.game.eviction-interval:PT5M}")
    public void evictIdleSessions() {
        int evicted = sessionStore.evictIdle(sessionTtl);
        if (evicted > 0) {
            LOGGER.info("Evicted idle sessions: count={}, remaining={}", evicted, sessionStore.size());
        }
    }
}
