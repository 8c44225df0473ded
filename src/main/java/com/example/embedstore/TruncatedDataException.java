package com.example.embedstore;

/**
 * Thrown when a header or record is shorter than its declared size.
 */
public class TruncatedDataException extends EmbeddingStoreException {

    public TruncatedDataException(String message) {
        super(message);
    }
}
