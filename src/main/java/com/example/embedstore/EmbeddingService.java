package com.example.embedstore;

import java.util.Collections;
import java.util.List;

/**
 * Turns text into fixed-dimension vectors. One implementation is active per
 * application; every vector it returns has the same dimension.
 */
public interface EmbeddingService {

    /**
     * Embeds a batch of texts in one provider call.
     *
     * @return one vector per input text, in input order
     * @throws EmbeddingProviderException if the provider fails
     */
    List<float[]> embed(List<String> texts);

    default float[] embed(String text) {
        List<float[]> vectors = embed(Collections.singletonList(text));
        if (vectors.size() != 1) {
            throw new EmbeddingProviderException("Expected 1 embedding, got " + vectors.size());
        }
        return vectors.get(0);
    }
}
