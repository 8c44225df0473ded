package com.example.embedstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads the line-delimited JSON store format, newest line first, yielding each key once.
 * Each line holds {@code {"key": ..., "text": ..., "embedding": [...], "timestamp": ...}}.
 *
 * <p>Lines are split on raw bytes, so a multi-byte UTF-8 character cut by a
 * window edge is reassembled before decoding. Blank and malformed lines are skipped.</p>
 */
@Slf4j
public class JsonLinesEntryReader {

    private final Path storePath;
    private final ObjectMapper mapper;

    public JsonLinesEntryReader(Path storePath) {
        this(storePath, new ObjectMapper());
    }

    public JsonLinesEntryReader(Path storePath, ObjectMapper mapper) {
        this.storePath = storePath;
        this.mapper = mapper;
    }

    public Stream<StoredEntry> entries() throws IOException {
        return entries(ChunkedReverseReader.DEFAULT_CHUNK_SIZE);
    }

    /**
     * @return newest-first deduplicated entries; empty if the file does not exist.
     *         The stream must be closed.
     */
    public Stream<StoredEntry> entries(int chunkSize) throws IOException {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        if (!Files.exists(storePath)) {
            return Stream.empty();
        }
        FileChannel channel = FileChannel.open(storePath, StandardOpenOption.READ);
        LineCursor cursor;
        try {
            cursor = new LineCursor(channel, chunkSize, channel.size());
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(cursor::close);
    }

    private final class LineCursor implements Iterator<StoredEntry>, Closeable {

        private final FileChannel channel;
        private final int chunkSize;
        private final Set<String> seenKeys = new HashSet<>();
        // complete lines of the current window, last line first
        private final Deque<byte[]> pending = new ArrayDeque<>();

        private long position;
        // bytes before the first newline of the previous window; the start of that line is further back
        private byte[] remainder = new byte[0];
        private StoredEntry next;

        LineCursor(FileChannel channel, int chunkSize, long fileSize) {
            this.channel = channel;
            this.chunkSize = chunkSize;
            this.position = fileSize;
        }

        @Override
        public boolean hasNext() {
            try {
                while (next == null) {
                    if (pending.isEmpty() && !fill()) {
                        return false;
                    }
                    byte[] line = pending.poll();
                    if (line == null) {
                        continue;
                    }
                    StoredEntry entry = parse(line);
                    if (entry != null && seenKeys.add(entry.getKey())) {
                        next = entry;
                    }
                }
                return true;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + storePath, e);
            }
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

        /**
         * Loads the next window backward and queues its complete lines.
         *
         * @return false once the file is exhausted and no line is left
         */
        private boolean fill() throws IOException {
            if (position <= 0) {
                if (remainder.length == 0) {
                    return false;
                }
                pending.add(remainder);
                remainder = new byte[0];
                return true;
            }

            long start = Math.max(0, position - chunkSize);
            int length = (int) (position - start);
            ByteBuffer buf = ByteBuffer.allocate(length + remainder.length);
            int read = BinaryFormat.readFully(channel, buf.limit(length), start);
            if (read < length) {
                throw new IOException("Short read at offset " + start + ": expected " + length + ", got " + read);
            }
            buf.limit(length + remainder.length);
            buf.put(remainder);
            byte[] combined = buf.array();
            position = start;

            int end = combined.length;
            for (int i = combined.length - 1; i >= 0; i--) {
                if (combined[i] == '\n') {
                    pending.add(Arrays.copyOfRange(combined, i + 1, end));
                    end = i;
                }
            }
            remainder = Arrays.copyOfRange(combined, 0, end);
            return true;
        }

        private StoredEntry parse(byte[] line) {
            String text = new String(line, StandardCharsets.UTF_8).trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                JsonNode node = mapper.readTree(text);
                JsonNode key = node.get("key");
                JsonNode embedding = node.get("embedding");
                if (key == null || !key.isTextual() || key.asText().isEmpty() || embedding == null || !embedding.isArray()) {
                    log.debug("{}: skipping line without key or embedding", storePath);
                    return null;
                }
                float[] vector = mapper.treeToValue(embedding, float[].class);
                return new StoredEntry(key.asText(), node.path("text").asText(""), vector, node.path("timestamp").asLong(0L));
            } catch (JsonProcessingException e) {
                log.debug("{}: skipping malformed line: {}", storePath, e.getOriginalMessage());
                return null;
            }
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
