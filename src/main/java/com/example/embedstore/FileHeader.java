package com.example.embedstore;

import lombok.Value;

/**
 * Decoded store file header.
 *
 * <pre>
 * +---------------------+
 * | Magic: 4 bytes      | "EMBD"
 * | Version: 2 bytes    | uint16, little-endian
 * | Dimension: 4 bytes  | uint32, little-endian
 * | Reserved: 6 bytes   | zero
 * +---------------------+
 * </pre>
 *
 * @see BinaryFormat#readHeader(java.nio.file.Path)
 */
@Value
public class FileHeader {

    int version;

    /**
     * Dimension shared by every record in the file.
     */
    int dimension;
}
