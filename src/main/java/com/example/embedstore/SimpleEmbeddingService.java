package com.example.embedstore;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Offline provider used when no embedding command is configured.
 * Vectors depend only on the text, so equal texts always get equal vectors.
 */
@Lazy
@Service
@ConditionalOnProperty(prefix = "embedding", name = "cli.enabled", havingValue = "false", matchIfMissing = true)
public class SimpleEmbeddingService implements EmbeddingService {

    public static final int DEFAULT_DIMENSION = 64;

    private final int dimension;

    @Autowired
    public SimpleEmbeddingService(Environment env) {
        this(env.getProperty("embedding.dimension", Integer.class, DEFAULT_DIMENSION));
    }

    public SimpleEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("embedding.dimension must be positive, got " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String text : texts) {
            out.add(embedOne(text));
        }
        return out;
    }

    // deterministic stub: hash-chained pseudo values in [-1,1]
    private float[] embedOne(String text) {
        float[] v = new float[dimension];
        int h = text.hashCode();
        for (int i = 0; i < dimension; i++) {
            h = 31 * h + i;
            v[i] = (Math.floorMod(h, 1000) - 500) / 500.0f;
        }
        return v;
    }

    public int getDimension() {
        return dimension;
    }
}
