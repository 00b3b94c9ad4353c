package com.nicolaswinsten.semantle.vocabulary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.nicolaswinsten.semantle.exception.VocabularyLoadException;

/**
 * The canonical, immutable set of guessable words and their embeddings.
 *
 * <p>Iteration order is the order entries were supplied in and is the tie-break basis for
 * ranking. Safe for concurrent reads; nothing changes after construction.
 */
public final class Vocabulary {

    private final List<String> words;
    private final Map<String, Integer> index;
    private final float[][] vectors;
    private final int dimensions;

    private Vocabulary(List<String> words, Map<String, Integer> index, float[][] vectors, int dimensions) {
        this.words = words;
        this.index = index;
        this.vectors = vectors;
        this.dimensions = dimensions;
    }

    /**
     * Builds a vocabulary from entries in iteration order.
     *
     * @throws VocabularyLoadException if the list is empty, a word is blank or duplicated after
     *                                 normalization, or a vector has a different dimensionality
     *                                 or a non-finite component
     */
    public static Vocabulary of(List<VocabularyEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new VocabularyLoadException("Vocabulary is empty");
        }
        List<String> words = new ArrayList<>(entries.size());
        Map<String, Integer> index = new HashMap<>(entries.size() * 2);
        float[][] vectors = new float[entries.size()][];
        int dimensions = -1;
        for (VocabularyEntry entry : entries) {
            String word = normalize(entry.word());
            if (word.isEmpty()) {
                throw new VocabularyLoadException("Vocabulary contains a blank word at position " + words.size());
            }
            float[] vector = entry.embedding();
            if (vector == null || vector.length == 0) {
                throw new VocabularyLoadException("Missing embedding for word '" + word + "'");
            }
            if (dimensions < 0) {
                dimensions = vector.length;
            } else if (vector.length != dimensions) {
                throw new VocabularyLoadException("Embedding for '" + word + "' has " + vector.length
                    + " dimensions, expected " + dimensions);
            }
            for (int i = 0; i < vector.length; i++) {
                // out-of-range JSON numbers parse to infinity and would score as NaN
                if (!Float.isFinite(vector[i])) {
                    throw new VocabularyLoadException("Embedding for '" + word + "' has a non-finite value at " + i);
                }
            }
            if (index.putIfAbsent(word, words.size()) != null) {
                throw new VocabularyLoadException("Duplicate word in vocabulary: '" + word + "'");
            }
            vectors[words.size()] = vector;
            words.add(word);
        }
        return new Vocabulary(Collections.unmodifiableList(words), index, vectors, dimensions);
    }

    /** Trims and lower-cases a word; {@code null} becomes the empty string. */
    public static String normalize(String word) {
        return word == null ? "" : word.trim().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive membership test. */
    public boolean contains(String word) {
        return index.containsKey(normalize(word));
    }

    /** All words in stable iteration order. */
    public List<String> allWords() {
        return words;
    }

    public Optional<float[]> vectorOf(String word) {
        Integer i = index.get(normalize(word));
        return i == null ? Optional.empty() : Optional.of(vectors[i]);
    }

    /** Position of {@code word} in iteration order, or -1. */
    public int indexOf(String word) {
        Integer i = index.get(normalize(word));
        return i == null ? -1 : i;
    }

    public String wordAt(int position) {
        return words.get(position);
    }

    public float[] vectorAt(int position) {
        return vectors[position];
    }

    public int size() {
        return words.size();
    }

    public int dimensions() {
        return dimensions;
    }
}
