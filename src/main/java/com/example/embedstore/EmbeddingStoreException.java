package com.example.embedstore;

/**
 * Base exception for embedding store failures.
 *
 * <p>Format, provider and dimension errors all extend this class, so callers can
 * tell an unreadable store apart from an empty result with a single catch.</p>
 */
public class EmbeddingStoreException extends RuntimeException {

    public EmbeddingStoreException(String message) {
        super(message);
    }

    public EmbeddingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
