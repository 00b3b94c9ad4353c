package com.nicolaswinsten.semantle.game;

import java.util.ArrayList;
import java.util.List;

import com.nicolaswinsten.semantle.vocabulary.Vocabulary;

/**
 * The whole vocabulary ordered by similarity to one target word.
 *
 * <p>Immutable once built. Rank 1 is always the target itself; ties in similarity keep
 * vocabulary order, so two rankings for the same target are identical.
 */
public final class Ranking {

    private final Vocabulary vocabulary;
    /** Similarity per vocabulary position. */
    private final double[] similarities;
    /** 1-based rank per vocabulary position. */
    private final int[] ranks;
    /** Vocabulary positions in rank order. */
    private final int[] order;

    Ranking(Vocabulary vocabulary, double[] similarities, int[] order) {
        this.vocabulary = vocabulary;
        this.similarities = similarities;
        this.order = order;
        this.ranks = new int[order.length];
        for (int r = 0; r < order.length; r++) {
            ranks[order[r]] = r + 1;
        }
    }

    /**
     * @throws IllegalArgumentException if {@code word} is not in the vocabulary
     */
    public int rankOf(String word) {
        return ranks[positionOf(word)];
    }

    /**
     * @throws IllegalArgumentException if {@code word} is not in the vocabulary
     */
    public double similarityOf(String word) {
        return similarities[positionOf(word)];
    }

    /** The word holding 1-based {@code rank}. */
    String wordAtRank(int rank) {
        if (rank < 1 || rank > order.length) {
            throw new IllegalArgumentException("Rank out of range: " + rank);
        }
        return vocabulary.wordAt(order[rank - 1]);
    }

    /** The first {@code limit} words in rank order, target included. */
    List<String> topWords(int limit) {
        int n = Math.min(Math.max(limit, 0), order.length);
        List<String> out = new ArrayList<>(n);
        for (int r = 0; r < n; r++) {
            out.add(vocabulary.wordAt(order[r]));
        }
        return out;
    }

    int size() {
        return order.length;
    }

    private int positionOf(String word) {
        int i = vocabulary.indexOf(word);
        if (i < 0) {
            throw new IllegalArgumentException("Word is not in the vocabulary: '" + word + "'");
        }
        return i;
    }
}
