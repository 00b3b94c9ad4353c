package com.nicolaswinsten.semantle.game;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nicolaswinsten.semantle.vocabulary.Vocabulary;

/**
 * Scores words against a target by cosine similarity and ranks the full vocabulary.
 *
 * <p>Pure in-memory computation; building a {@link Ranking} is {@code O(V log V)} so callers
 * keep the result for the lifetime of a session rather than re-ranking on every guess.
 */
public class SimilarityRanker {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimilarityRanker.class);

    private final Vocabulary vocabulary;

    public SimilarityRanker(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Cosine similarity {@code dot(a,b) / (|a|*|b|)}, clamped to [-1, 1].
     * Returns 0 when either vector has zero norm.
     *
     * @throws IllegalArgumentException if the vectors differ in length
     */
    public static double similarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        double cos = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    /** Ranks the vocabulary against a vocabulary word, using its stored vector. */
    Ranking rank(String targetWord) {
        String target = Vocabulary.normalize(targetWord);
        float[] vector = vocabulary.vectorOf(target)
            .orElseThrow(() -> new IllegalArgumentException("Target is not in the vocabulary"));
        return rank(target, vector);
    }

    /**
     * Ranks every vocabulary word by similarity to {@code targetVector}, descending.
     * The target word is pinned to rank 1 with similarity 1.0; ties keep vocabulary order.
     */
    public Ranking rank(String targetWord, float[] targetVector) {
        String target = Vocabulary.normalize(targetWord);
        int size = vocabulary.size();
        int targetIndex = vocabulary.indexOf(target);
        double[] similarities = new double[size];
        for (int i = 0; i < size; i++) {
            similarities[i] = i == targetIndex ? 1.0 : similarity(targetVector, vocabulary.vectorAt(i));
        }

        Integer[] positions = new Integer[size];
        for (int i = 0; i < size; i++) {
            positions[i] = i;
        }
        Arrays.sort(positions, (x, y) -> {
            if (x == targetIndex) {
                return y == targetIndex ? 0 : -1;
            }
            if (y == targetIndex) {
                return 1;
            }
            int bySimilarity = Double.compare(similarities[y], similarities[x]);
            return bySimilarity != 0 ? bySimilarity : Integer.compare(x, y);
        });

        int[] order = new int[size];
        for (int r = 0; r < size; r++) {
            order[r] = positions[r];
        }
        LOGGER.debug("Ranked {} words for a new target", size);
        return new Ranking(vocabulary, similarities, order);
    }
}
