package com.nicolaswinsten.semantle.embedding;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;

import com.nicolaswinsten.semantle.exception.EmbeddingProviderException;
import com.nicolaswinsten.semantle.vocabulary.Vocabulary;

/**
 * Resolves the vector for a word: precomputed vocabulary vectors first, then the
 * {@link EmbeddingProvider} on a bounded executor with a hard timeout.
 *
 * <p>Provider calls never run on the request thread's critical path without a bound, so a slow
 * provider cannot stall sessions that only need in-memory ranking. A call that times out is
 * cancelled with an interrupt, which frees its pool thread.
 */
public class EmbeddingService {
    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingService.class);

    private final Vocabulary vocabulary;
    private final EmbeddingProvider provider;
    private final AsyncTaskExecutor executor;
    private final Duration timeout;

    public EmbeddingService(Vocabulary vocabulary, EmbeddingProvider provider, AsyncTaskExecutor executor, Duration timeout) {
        this.vocabulary = vocabulary;
        this.provider = provider;
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Returns the embedding for {@code word}.
     *
     * @throws EmbeddingProviderException if the word is not precomputed and the provider fails,
     *                                    times out, or the calling thread is interrupted
     */
    public float[] resolve(String word) {
        String normalized = Vocabulary.normalize(word);
        Optional<float[]> known = vocabulary.vectorOf(normalized);
        if (known.isPresent()) {
            return known.get();
        }
        LOGGER.debug("Vector cache miss, calling provider={}", provider.name());
        Future<float[]> future;
        try {
            future = executor.submit(() -> provider.embed(normalized));
        } catch (RejectedExecutionException e) {
            throw new EmbeddingProviderException(provider.name(), "Embedding executor is saturated", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.warn("Embedding request timed out: provider={}, timeoutMs={}", provider.name(), timeout.toMillis());
            throw new EmbeddingProviderException(provider.name(), "Embedding request timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingProviderException(provider.name(), "Interrupted while waiting for embedding", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EmbeddingProviderException providerError) {
                throw providerError;
            }
            throw new EmbeddingProviderException(provider.name(), "Embedding request failed", cause);
        }
    }
}
