package com.example.embedstore;

import lombok.Value;

/**
 * One hit of {@link StorageEngine#search(String, int, double)}.
 */
@Value
public class SearchResult {

    String key;

    /**
     * Cosine similarity between the query and the stored vector, in [-1, 1].
     */
    double similarity;
}
