package com.nicolaswinsten.semantle.vocabulary;

/**
 * A single vocabulary word and its embedding vector.
 *
 * @param word      normalized (trimmed, lower-case) word
 * @param embedding fixed-length vector; not copied, callers must not mutate it
 */
public record VocabularyEntry(String word, float[] embedding) {}
