package com.example.embedstore;

/**
 * Thrown when the embedding provider fails to produce vectors.
 */
public class EmbeddingProviderException extends EmbeddingStoreException {

    public EmbeddingProviderException(String message) {
        super(message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
