package com.example.embedstore;

import lombok.Value;

/**
 * Logical store entry. The binary format keeps neither the source text nor a
 * write timestamp, so entries decoded from it carry an empty text and a zero timestamp.
 */
@Value
public class StoredEntry {

    String key;

    String text;

    float[] embedding;

    long timestamp;

    public static StoredEntry of(String key, float[] embedding) {
        return new StoredEntry(key, "", embedding, 0L);
    }
}
