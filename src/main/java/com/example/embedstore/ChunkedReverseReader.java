package com.example.embedstore;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads a store file from the end towards the header and yields each key once,
 * newest version first.
 *
 * <p>The file is read in windows of at most {@code chunkSize} bytes. Records are
 * located through their trailing length footer. A record that does not fit in
 * the current window (including one larger than the window itself) is fetched
 * with one extra read sized to exactly that record. Memory use is one window
 * plus the set of keys already yielded.</p>
 *
 * <p>If the newest bytes do not form a complete record (a write interrupted by a
 * crash), the file is walked forward once from the header and the scan restarts
 * at the end of the last complete record. Only the interrupted record is lost.
 * A bad record found after that point is reported as {@link CorruptRecordException}.</p>
 *
 * <h2>Usage</h2>
 * <pre>
 * try (Stream&lt;StoredEntry&gt; entries = new ChunkedReverseReader(path).entries()) {
 *     entries.filter(e -&gt; e.getKey().equals(key)).findFirst();
 * }
 * </pre>
 *
 * <p>Every call to {@link #entries()} opens its own channel and keeps its own
 * cursor, so concurrent scans of the same file do not interfere.</p>
 */
@Slf4j
public class ChunkedReverseReader {

    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    private final Path storePath;
    private final int chunkSize;

    public ChunkedReverseReader(Path storePath) {
        this(storePath, DEFAULT_CHUNK_SIZE);
    }

    public ChunkedReverseReader(Path storePath, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        this.storePath = storePath;
        this.chunkSize = chunkSize;
    }

    public Path getStorePath() {
        return storePath;
    }

    /**
     * Opens a new scan. The header is validated before this method returns;
     * records are decoded lazily as the stream is consumed.
     *
     * <p>The returned stream holds an open file channel and must be closed.
     * I/O failures while scanning are rethrown as {@link UncheckedIOException}.</p>
     *
     * @throws TruncatedDataException if the file is shorter than a header
     * @throws InvalidFormatException if the magic bytes do not match
     * @throws UnsupportedVersionException if the file was written by a newer format version
     */
    public Stream<StoredEntry> entries() throws IOException {
        FileChannel channel = FileChannel.open(storePath, StandardOpenOption.READ);
        try {
            FileHeader header = BinaryFormat.readHeader(channel);
            Cursor cursor = new Cursor(channel, header.getDimension(), channel.size());
            Spliterator<StoredEntry> spliterator = Spliterators.spliteratorUnknownSize(cursor,
                    Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.DISTINCT);
            return StreamSupport.stream(spliterator, false).onClose(cursor::close);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    /**
     * Per-scan state: the backward position, the loaded window and the keys seen so far.
     */
    private final class Cursor implements Iterator<StoredEntry>, Closeable {

        private final FileChannel channel;
        private final int dimension;
        private final int minRecordLength;
        private final Set<String> seenKeys = new HashSet<>();

        // absolute offset of the first byte not yet consumed by the backward scan
        private long position;
        private ByteBuffer window;
        private long windowStart;
        // bytes of the window in front of position, i.e. position - windowStart
        private int windowRemaining;

        private StoredEntry next;
        private boolean finished;
        // set once a record ending at the scan position has decoded, or after a resync
        private boolean tailVerified;

        Cursor(FileChannel channel, int dimension, long fileSize) {
            this.channel = channel;
            this.dimension = dimension;
            this.minRecordLength = BinaryFormat.minRecordLength(dimension);
            this.position = fileSize;
            this.finished = fileSize <= BinaryFormat.HEADER_SIZE;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !finished) {
                try {
                    next = advance();
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read " + storePath, e);
                }
            }
            return next != null;
        }

        @Override
        public StoredEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            StoredEntry entry = next;
            next = null;
            return entry;
        }

        private StoredEntry advance() throws IOException {
            while (true) {
                long available = position - BinaryFormat.HEADER_SIZE;
                if (available < BinaryFormat.FOOTER_SIZE) {
                    if (available > 0 && !tailVerified) {
                        resync();
                        continue;
                    }
                    if (available > 0) {
                        log.warn("{}: {} stray bytes after the header, stopping scan", storePath, available);
                    }
                    return finish();
                }
                if (window == null || windowRemaining < BinaryFormat.FOOTER_SIZE) {
                    loadWindow();
                }

                long recordLength = Integer.toUnsignedLong(window.getInt(windowRemaining - BinaryFormat.FOOTER_SIZE));
                if (recordLength < minRecordLength || recordLength > available) {
                    if (!tailVerified) {
                        resync();
                        continue;
                    }
                    log.warn("{}: unusable record length {} at offset {}, stopping scan",
                            storePath, recordLength, position);
                    return finish();
                }

                int length = (int) recordLength;
                long recordStart = position - length;
                BinaryRecord record;
                try {
                    if (length <= windowRemaining) {
                        int start = windowRemaining - length;
                        record = BinaryFormat.decodeRecord(window, start, length, dimension, recordStart);
                        windowRemaining = start;
                    } else {
                        record = readDirect(recordStart, length);
                        // the rest of the window belongs to this record
                        windowRemaining = 0;
                    }
                } catch (CorruptRecordException e) {
                    if (tailVerified) {
                        throw e;
                    }
                    resync();
                    continue;
                }
                position = recordStart;
                tailVerified = true;

                if (seenKeys.add(record.getKey())) {
                    return record.toEntry();
                }
            }
        }

        /**
         * Walks the file forward from the header to the end of the last complete
         * record and restarts the backward scan there. Only used while the tail
         * of the file has not produced a valid record yet.
         */
        private void resync() throws IOException {
            long boundary = BinaryFormat.lastRecordBoundary(channel, dimension);
            log.warn("{}: incomplete record at the end of the file, ignoring {} trailing bytes",
                    storePath, position - boundary);
            position = boundary;
            window = null;
            windowRemaining = 0;
            tailVerified = true;
        }

        private void loadWindow() throws IOException {
            windowStart = Math.max(BinaryFormat.HEADER_SIZE, position - Math.max(chunkSize, BinaryFormat.FOOTER_SIZE));
            int length = (int) (position - windowStart);
            if (window == null || window.capacity() < length) {
                window = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
            } else {
                window.clear();
                window.limit(length);
            }
            int read = BinaryFormat.readFully(channel, window, windowStart);
            if (read < length) {
                throw new IOException("Short read at offset " + windowStart + ": expected " + length + ", got " + read);
            }
            windowRemaining = length;
        }

        private BinaryRecord readDirect(long recordStart, int length) throws IOException {
            ByteBuffer buf = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
            int read = BinaryFormat.readFully(channel, buf, recordStart);
            if (read < length) {
                throw new IOException("Short read at offset " + recordStart + ": expected " + length + ", got " + read);
            }
            return BinaryFormat.decodeRecord(buf, 0, length, dimension, recordStart);
        }

        private StoredEntry finish() {
            finished = true;
            window = null;
            return null;
        }

        @Override
        public void close() {
            try {
                channel.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
