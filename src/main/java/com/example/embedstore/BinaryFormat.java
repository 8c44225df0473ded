package com.example.embedstore;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Encoding and decoding of the append-only store file.
 *
 * <h2>File Format</h2>
 * <pre>
 * +-----------------------+
 * | Header (16 bytes)     |
 * +-----------------------+
 * | Magic: 4 bytes        | "EMBD"
 * | Version: 2 bytes      | uint16
 * | Dimension: 4 bytes    | uint32
 * | Reserved: 6 bytes     | zero
 * +-----------------------+
 * | Records...            | appended, no padding
 * +-----------------------+
 * | KeyLen: 2 bytes       | uint16
 * | Key: KeyLen bytes     | UTF-8
 * | Vector: Dim*4 bytes   | float32
 * | Length: 4 bytes       | uint32, total record length (footer included)
 * +-----------------------+
 * </pre>
 * All multi-byte values are little-endian. The trailing length lets
 * {@link ChunkedReverseReader} walk the file from the end.
 */
@Slf4j
public final class BinaryFormat {

    public static final byte[] MAGIC_BYTES = new byte[] { 'E', 'M', 'B', 'D' };
    public static final int CURRENT_VERSION = 1;
    public static final int HEADER_SIZE = 16;
    public static final int MAX_KEY_LENGTH = 0xFFFF;

    static final int KEY_LENGTH_SIZE = 2;
    static final int FOOTER_SIZE = 4;

    private BinaryFormat() {}

    /**
     * Creates (or replaces) the file at {@code path} with a fresh header.
     * Missing parent directories are created.
     */
    public static void writeHeader(Path path, int dimension) throws IOException {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive, got " + dimension);
        }
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(MAGIC_BYTES);
        buf.putShort((short) CURRENT_VERSION);
        buf.putInt(dimension);
        // bytes 10..16 are reserved and stay zero

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, buf.array());
        log.info("Created store {} (version={}, dimension={})", path, CURRENT_VERSION, dimension);
    }

    public static FileHeader readHeader(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return readHeader(channel);
        }
    }

    static FileHeader readHeader(FileChannel channel) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        int read = readFully(channel, buf, 0);
        if (read < HEADER_SIZE) {
            throw new TruncatedDataException("File too small: expected at least " + HEADER_SIZE + " bytes, got " + read);
        }

        byte[] magic = new byte[MAGIC_BYTES.length];
        buf.get(0, magic);
        if (!Arrays.equals(magic, MAGIC_BYTES)) {
            throw new InvalidFormatException("Invalid file format: magic bytes expected \"EMBD\", got \""
                    + new String(magic, StandardCharsets.ISO_8859_1) + "\"");
        }

        int version = Short.toUnsignedInt(buf.getShort(4));
        if (version == 0 || version > CURRENT_VERSION) {
            throw new UnsupportedVersionException(version, CURRENT_VERSION);
        }

        long dimension = Integer.toUnsignedLong(buf.getInt(6));
        if (dimension == 0 || dimension > Integer.MAX_VALUE / Float.BYTES) {
            throw new InvalidFormatException("Invalid file format: dimension " + dimension);
        }
        return new FileHeader(version, (int) dimension);
    }

    /**
     * Encoded size of a record: {@code 2 + keyLength + dimension * 4 + 4}.
     */
    public static int recordLength(int keyLength, int dimension) {
        return Math.toIntExact(KEY_LENGTH_SIZE + (long) keyLength + (long) dimension * Float.BYTES + FOOTER_SIZE);
    }

    /**
     * Smallest record a file of the given dimension can hold (empty key).
     */
    static int minRecordLength(int dimension) {
        return recordLength(0, dimension);
    }

    /**
     * Appends one record with a single write.
     */
    public static void writeRecord(Path path, String key, float[] embedding) throws IOException {
        byte[] keyBytes = encodeKey(key);
        ByteBuffer buf = ByteBuffer.allocate(recordLength(keyBytes.length, checkEmbedding(embedding)))
                .order(ByteOrder.LITTLE_ENDIAN);
        putRecord(buf, keyBytes, embedding);
        append(path, buf.array());
    }

    /**
     * Appends all records with a single write. The whole batch is encoded in
     * memory first, so a failure while encoding leaves the file untouched.
     */
    public static void writeRecords(Path path, List<StoredEntry> entries) throws IOException {
        if (entries.isEmpty()) {
            return;
        }
        List<byte[]> keys = new ArrayList<>(entries.size());
        long total = 0;
        for (StoredEntry entry : entries) {
            byte[] keyBytes = encodeKey(entry.getKey());
            keys.add(keyBytes);
            total += recordLength(keyBytes.length, checkEmbedding(entry.getEmbedding()));
        }

        ByteBuffer buf = ByteBuffer.allocate(Math.toIntExact(total)).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < entries.size(); i++) {
            putRecord(buf, keys.get(i), entries.get(i).getEmbedding());
        }
        append(path, buf.array());
        log.debug("Appended {} records ({} bytes) to {}", entries.size(), total, path);
    }

    /**
     * Reads the record starting at {@code offset}: first the key length, then
     * exactly the number of bytes the record must occupy.
     *
     * @return the record, or empty when {@code offset} is at or past the end of the file
     * @throws TruncatedDataException if the file ends inside the record
     * @throws CorruptRecordException if the length footer does not match
     */
    public static Optional<BinaryRecord> readRecordForward(Path path, int dimension, long offset) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return readRecordForward(channel, dimension, offset);
        }
    }

    static Optional<BinaryRecord> readRecordForward(FileChannel channel, int dimension, long offset) throws IOException {
        if (offset >= channel.size()) {
            return Optional.empty();
        }

        ByteBuffer keyLengthBuf = ByteBuffer.allocate(KEY_LENGTH_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        if (readFully(channel, keyLengthBuf, offset) < KEY_LENGTH_SIZE) {
            throw new TruncatedDataException("Record at offset " + offset + " is missing its key length");
        }
        int keyLength = Short.toUnsignedInt(keyLengthBuf.getShort(0));
        int recordLength = recordLength(keyLength, dimension);
        if (offset + recordLength > channel.size()) {
            throw new TruncatedDataException("Record at offset " + offset + " declares " + recordLength
                    + " bytes, only " + (channel.size() - offset) + " available");
        }

        ByteBuffer recordBuf = ByteBuffer.allocate(recordLength).order(ByteOrder.LITTLE_ENDIAN);
        int read = readFully(channel, recordBuf, offset);
        if (read < recordLength) {
            throw new TruncatedDataException("Record at offset " + offset + " declares " + recordLength
                    + " bytes, only " + read + " available");
        }
        return Optional.of(decodeRecord(recordBuf, 0, recordLength, dimension, offset));
    }

    /**
     * Decodes the record occupying {@code buf[start, start + length)}.
     *
     * @param fileOffset absolute offset of the record, for error reporting
     */
    static BinaryRecord decodeRecord(ByteBuffer buf, int start, int length, int dimension, long fileOffset) {
        ByteBuffer view = buf.order(ByteOrder.LITTLE_ENDIAN);
        int keyLength = Short.toUnsignedInt(view.getShort(start));
        long expected = KEY_LENGTH_SIZE + (long) keyLength + (long) dimension * Float.BYTES + FOOTER_SIZE;
        long stored = Integer.toUnsignedLong(view.getInt(start + length - FOOTER_SIZE));
        if (expected != stored || stored != length) {
            throw new CorruptRecordException(fileOffset, expected, stored);
        }

        byte[] keyBytes = new byte[keyLength];
        view.get(start + KEY_LENGTH_SIZE, keyBytes);
        String key = new String(keyBytes, StandardCharsets.UTF_8);

        float[] embedding = new float[dimension];
        int pos = start + KEY_LENGTH_SIZE + keyLength;
        for (int i = 0; i < dimension; i++) {
            embedding[i] = view.getFloat(pos);
            pos += Float.BYTES;
        }
        return new BinaryRecord(key, embedding, length);
    }

    /**
     * Positional read that keeps going until {@code buf} is full or the file ends.
     *
     * @return number of bytes read
     */
    static int readFully(FileChannel channel, ByteBuffer buf, long position) throws IOException {
        int total = 0;
        while (buf.hasRemaining()) {
            int n = channel.read(buf, position + total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    /**
     * Cuts off an interrupted record at the end of the file, so the next append
     * follows the last complete record instead of the leftover bytes.
     *
     * @return number of bytes removed
     */
    public static long truncateIncompleteTail(Path path, int dimension) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            if (endsWithCompleteRecord(channel, dimension, size)) {
                return 0;
            }
            long boundary = lastRecordBoundary(channel, dimension);
            channel.truncate(boundary);
            log.warn("Removed {} bytes of an incomplete record from the end of {}", size - boundary, path);
            return size - boundary;
        }
    }

    /**
     * Walks the records forward from the header.
     *
     * @return the offset just past the last complete record
     */
    static long lastRecordBoundary(FileChannel channel, int dimension) throws IOException {
        long boundary = HEADER_SIZE;
        try {
            Optional<BinaryRecord> record;
            while ((record = readRecordForward(channel, dimension, boundary)).isPresent()) {
                boundary += record.get().getRecordLength();
            }
        } catch (TruncatedDataException | CorruptRecordException e) {
            log.debug("Forward walk stopped at offset {}: {}", boundary, e.getMessage());
        }
        return boundary;
    }

    private static boolean endsWithCompleteRecord(FileChannel channel, int dimension, long size) throws IOException {
        long available = size - HEADER_SIZE;
        if (available <= 0) {
            return true;
        }
        if (available < FOOTER_SIZE) {
            return false;
        }
        ByteBuffer footer = ByteBuffer.allocate(FOOTER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        readFully(channel, footer, size - FOOTER_SIZE);
        long length = Integer.toUnsignedLong(footer.getInt(0));
        if (length < minRecordLength(dimension) || length > available) {
            return false;
        }
        ByteBuffer buf = ByteBuffer.allocate((int) length).order(ByteOrder.LITTLE_ENDIAN);
        if (readFully(channel, buf, size - length) < length) {
            return false;
        }
        try {
            decodeRecord(buf, 0, (int) length, dimension, size - length);
            return true;
        } catch (CorruptRecordException e) {
            log.debug("Last record does not decode: {}", e.getMessage());
            return false;
        }
    }

    /**
     * @throws IllegalArgumentException if the key is empty or longer than {@link #MAX_KEY_LENGTH} UTF-8 bytes
     */
    static void checkKey(String key) {
        encodeKey(key);
    }

    private static byte[] encodeKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key must be provided.");
        }
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Key is " + keyBytes.length + " UTF-8 bytes, at most "
                    + MAX_KEY_LENGTH + " allowed");
        }
        return keyBytes;
    }

    private static int checkEmbedding(float[] embedding) {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Embedding must not be empty.");
        }
        return embedding.length;
    }

    private static void putRecord(ByteBuffer buf, byte[] keyBytes, float[] embedding) {
        buf.putShort((short) keyBytes.length);
        buf.put(keyBytes);
        for (float f : embedding) {
            buf.putFloat(f);
        }
        buf.putInt(recordLength(keyBytes.length, embedding.length));
    }

    private static void append(Path path, byte[] bytes) throws IOException {
        Files.write(path, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
