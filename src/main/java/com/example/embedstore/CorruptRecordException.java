package com.example.embedstore;

/**
 * Thrown when a record's length footer disagrees with the length computed from its key.
 */
public class CorruptRecordException extends EmbeddingStoreException {

    private final long offset;

    public CorruptRecordException(long offset, long expectedLength, long storedLength) {
        super("Record length mismatch at offset " + offset + ": expected " + expectedLength + ", got " + storedLength);
        this.offset = offset;
    }

    /**
     * @return absolute file offset of the first byte of the record
     */
    public long getOffset() {
        return offset;
    }
}
