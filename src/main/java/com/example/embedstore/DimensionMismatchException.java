package com.example.embedstore;

/**
 * Thrown when two vectors, or a vector and a store file, disagree on dimension.
 */
public class DimensionMismatchException extends EmbeddingStoreException {

    private final int expected;
    private final int actual;

    /**
     * @param expected dimension required by the file or the first operand
     * @param actual dimension that was provided
     */
    public DimensionMismatchException(int expected, int actual) {
        super("Dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
