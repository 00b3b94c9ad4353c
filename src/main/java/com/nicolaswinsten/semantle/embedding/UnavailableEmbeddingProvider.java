package com.nicolaswinsten.semantle.embedding;

import java.util.List;

import com.nicolaswinsten.semantle.exception.EmbeddingProviderException;

/** Used when no provider is configured; every call fails. */
public class UnavailableEmbeddingProvider implements EmbeddingProvider {

    @Override
    public List<float[]> embed(List<String> words) {
        throw new EmbeddingProviderException(name(), "No embedding provider configured");
    }

    @Override
    public String name() {
        return "none";
    }
}
