package com.nicolaswinsten.semantle.game;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional LRU of rankings shared by sessions with the same target (daily games in particular).
 *
 * <p>Rankings are immutable, so sharing them does not affect the single-writer discipline on
 * sessions. Two sessions missing at once may both build the same ranking; the first one stored wins.
 */
public class RankingCache {

    private final SimilarityRanker ranker;
    private final int capacity;
    private final Map<String, Ranking> entries;

    public RankingCache(SimilarityRanker ranker, int capacity) {
        this.ranker = ranker;
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Ranking> eldest) {
                return size() > RankingCache.this.capacity;
            }
        };
    }

    /** Returns the cached ranking for {@code targetWord}, building it on a miss. */
    public Ranking rankingFor(String targetWord, float[] targetVector) {
        if (capacity <= 0) {
            return ranker.rank(targetWord, targetVector);
        }
        synchronized (entries) {
            Ranking cached = entries.get(targetWord);
            if (cached != null) {
                return cached;
            }
        }
        Ranking built = ranker.rank(targetWord, targetVector);
        synchronized (entries) {
            Ranking raced = entries.putIfAbsent(targetWord, built);
            return raced != null ? raced : built;
        }
    }

    int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
