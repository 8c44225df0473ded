package com.example.embedstore;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

public final class VectorUtils {

    private static final ObjectMapper mapper = new ObjectMapper();

    private VectorUtils() {}

    /**
     * Cosine similarity {@code dot(a, b) / (|a| * |b|)}.
     *
     * @return a value in [-1, 1], or exactly 0 when either vector has zero magnitude
     * @throws DimensionMismatchException if the vectors differ in length
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double dot = 0.0, na = 0.0, nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        double similarity = dot / (Math.sqrt(na) * Math.sqrt(nb));
        // rounding can push |similarity| a hair past 1 for (anti)parallel vectors
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    public static float[] jsonToFloatArray(String json) throws IOException {
        return mapper.readValue(json, float[].class);
    }

    /**
     * Parses either a JSON array of numbers or comma/whitespace separated floats.
     *
     * @throws NumberFormatException if the text is neither
     */
    public static float[] parseFloats(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("[")) {
            try {
                return jsonToFloatArray(trimmed);
            } catch (IOException e) {
                NumberFormatException nfe = new NumberFormatException("Not a JSON float array: " + abbreviate(trimmed));
                nfe.initCause(e);
                throw nfe;
            }
        }
        String cleaned = trimmed.replaceAll("[,\\s]+", " ").trim();
        if (cleaned.isEmpty()) {
            throw new NumberFormatException("No floats in empty text");
        }
        String[] parts = cleaned.split(" ");
        float[] out = new float[parts.length];
        for (int i = 0; i < parts.length; i++) out[i] = Float.parseFloat(parts[i]);
        return out;
    }

    private static String abbreviate(String s) {
        return s.length() > 80 ? s.substring(0, 80) + "..." : s;
    }
}
