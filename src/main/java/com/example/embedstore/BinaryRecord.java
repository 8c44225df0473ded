package com.example.embedstore;

import lombok.Value;

/**
 * A record decoded from the store file together with its encoded size in bytes.
 */
@Value
public class BinaryRecord {

    String key;

    float[] embedding;

    /**
     * Total encoded length, footer included. Forward readers add this to the
     * record offset to reach the next record.
     */
    int recordLength;

    public StoredEntry toEntry() {
        return StoredEntry.of(key, embedding);
    }
}
