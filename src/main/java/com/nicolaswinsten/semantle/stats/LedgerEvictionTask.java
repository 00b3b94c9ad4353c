package com.nicolaswinsten.semantle.stats;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/** Periodically drops player ledgers nobody has touched within the ledger TTL. */
public class LedgerEvictionTask {
    private static final Logger LOGGER = LoggerFactory.getLogger(LedgerEvictionTask.class);

    private final StatsService statsService;
    private final Duration ledgerTtl;

    public LedgerEvictionTask(StatsService statsService, Duration ledgerTtl) {
        this.statsService = statsService;
        this.ledgerTtl = ledgerTtl;
    }

    @Scheduled(fixedDelayString = "${semantle.game.eviction-interval:PT5M}")
    public void evictIdleLedgers() {
        int evicted = statsService.evictIdle(ledgerTtl);
        if (evicted > 0) {
            LOGGER.info("Evicted idle player ledgers: count={}, remaining={}", evicted, statsService.playerCount());
        }
    }
}
