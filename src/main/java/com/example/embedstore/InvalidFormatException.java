package com.example.embedstore;

/**
 * Thrown when a store file does not start with the expected magic bytes.
 */
public class InvalidFormatException extends EmbeddingStoreException {

    public InvalidFormatException(String message) {
        super(message);
    }
}
