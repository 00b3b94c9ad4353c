package com.nicolaswinsten.semantle.exception;

/**
 * Thrown when the embedding provider fails, times out, or is not configured.
 * Retryable: callers never observe a partially created or updated session.
 */
public class EmbeddingProviderException extends SemantleException {

    private final String providerName;

    public EmbeddingProviderException(String providerName, String message) {
        super(message);
        this.providerName = providerName;
    }

    public EmbeddingProviderException(String providerName, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }

    @Override
    public String getErrorCode() {
        return "ProviderError";
    }
}
