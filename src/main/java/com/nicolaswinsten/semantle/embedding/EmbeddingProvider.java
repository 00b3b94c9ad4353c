package com.nicolaswinsten.semantle.embedding;

import java.util.List;

import com.nicolaswinsten.semantle.exception.EmbeddingProviderException;

/**
 * Turns words into embedding vectors. Implementations may block on network I/O and are only
 * ever called through {@link EmbeddingService} or at vocabulary load time.
 */
public interface EmbeddingProvider {

    /**
     * Embeds each word, preserving input order.
     *
     * @throws EmbeddingProviderException if the provider is unavailable or returns a bad response
     */
    List<float[]> embed(List<String> words);

    default float[] embed(String word) {
        List<float[]> vectors = embed(List.of(word));
        if (vectors.isEmpty()) {
            throw new EmbeddingProviderException(name(), "Embedding response was empty");
        }
        return vectors.get(0);
    }

    /** Short name used in logs and errors. */
    String name();
}
