package com.example.embedstore;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only embedding store backed by a single file.
 *
 * <p>Writes append records; reads re-scan the file from the end, so the most
 * recent record for a key wins without any index. Reads may run concurrently
 * with each other. Writes are not synchronized: at most one writer per file.</p>
 *
 * <p>The embedding provider is created on first use through the supplied
 * factory and kept until {@link #dispose()}.</p>
 */
@Slf4j
public class StorageEngine {

    public static final int DEFAULT_SEARCH_LIMIT = 10;
    public static final double DEFAULT_MIN_SIMILARITY = 0.5;

    private final Path storePath;
    private final ChunkedReverseReader reader;
    private final Supplier<? extends EmbeddingService> providerFactory;

    private EmbeddingService provider;

    public StorageEngine(Path storePath, Supplier<? extends EmbeddingService> providerFactory) {
        this(storePath, ChunkedReverseReader.DEFAULT_CHUNK_SIZE, providerFactory);
    }

    public StorageEngine(Path storePath, int chunkSize, Supplier<? extends EmbeddingService> providerFactory) {
        this.storePath = storePath;
        this.reader = new ChunkedReverseReader(storePath, chunkSize);
        this.providerFactory = providerFactory;
    }

    public Path getStorePath() {
        return storePath;
    }

    /**
     * Embeds {@code text} and appends it under {@code key}. Creates the file,
     * sized to the vector's dimension, on first use.
     */
    public void store(String key, String text) throws IOException {
        BinaryFormat.checkKey(key);
        float[] embedding = generateEmbedding(text);
        prepareFile(fileDimension(embedding.length), embedding.length);
        BinaryFormat.writeRecord(storePath, key, embedding);
        log.debug("Stored key {} (dimension={})", key, embedding.length);
    }

    /**
     * Embeds all texts with a single provider call and appends every record with a single write.
     *
     * @throws IllegalArgumentException if {@code items} is empty
     * @throws IllegalStateException if the provider returns a different number of vectors
     */
    public void storeMany(List<StoreItem> items) throws IOException {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Items array must not be empty.");
        }
        for (StoreItem item : items) {
            BinaryFormat.checkKey(item.getKey());
        }

        List<String> texts = items.stream().map(StoreItem::getText).collect(Collectors.toList());
        List<float[]> embeddings = getOrInitProvider().embed(texts);
        if (embeddings.size() != items.size()) {
            throw new IllegalStateException("Number of embeddings must match number of items: expected "
                    + items.size() + ", got " + embeddings.size());
        }

        int dimension = fileDimension(embeddings.get(0).length);
        List<StoredEntry> records = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            float[] embedding = embeddings.get(i);
            if (embedding.length != dimension) {
                throw new DimensionMismatchException(dimension, embedding.length);
            }
            records.add(StoredEntry.of(items.get(i).getKey(), embedding));
        }
        prepareFile(dimension, dimension);
        BinaryFormat.writeRecords(storePath, records);
        log.info("Stored {} items in {}", records.size(), storePath);
    }

    /**
     * @return the most recently stored entry for {@code key}, or empty if the key
     *         (or the store file) does not exist
     */
    public Optional<StoredEntry> get(String key) throws IOException {
        requireKey(key);
        if (!Files.exists(storePath)) {
            return Optional.empty();
        }
        try (Stream<StoredEntry> entries = reader.entries()) {
            return entries.filter(e -> e.getKey().equals(key)).findFirst();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public List<SearchResult> search(String query) throws IOException {
        return search(query, DEFAULT_SEARCH_LIMIT, DEFAULT_MIN_SIMILARITY);
    }

    /**
     * Scores every stored key against {@code query} and returns the best
     * {@code limit} with similarity of at least {@code minSimilarity}, best first.
     */
    public List<SearchResult> search(String query, int limit, double minSimilarity) throws IOException {
        if (query == null || query.isEmpty()) {
            throw new IllegalArgumentException("Query text must be provided.");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be a positive integer.");
        }
        if (!(minSimilarity >= 0 && minSimilarity <= 1)) {
            throw new IllegalArgumentException("minSimilarity must be between 0 and 1.");
        }
        if (!Files.exists(storePath)) {
            return Collections.emptyList();
        }

        float[] queryEmbedding = generateEmbedding(query);
        CandidateSet candidates = new CandidateSet(limit);
        int scanned = 0;
        try (Stream<StoredEntry> entries = reader.entries()) {
            Iterable<StoredEntry> iterable = entries::iterator;
            for (StoredEntry entry : iterable) {
                scanned++;
                double similarity = VectorUtils.cosineSimilarity(queryEmbedding, entry.getEmbedding());
                if (similarity < minSimilarity) {
                    continue;
                }
                candidates.add(entry.getKey(), similarity);
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        log.debug("Search scanned {} keys, kept {}", scanned, candidates.count());

        return candidates.entries().stream()
                .map(c -> new SearchResult(c.getKey(), c.getValue()))
                .collect(Collectors.toList());
    }

    /**
     * Copies a line-delimited JSON store into this store without re-embedding.
     * Only the newest entry per key is kept; entries are appended oldest first in one write.
     *
     * @return number of imported entries
     */
    public int importJsonLines(Path source) throws IOException {
        List<StoredEntry> newestFirst;
        try (Stream<StoredEntry> entries = new JsonLinesEntryReader(source).entries()) {
            newestFirst = entries.collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        if (newestFirst.isEmpty()) {
            log.info("Nothing to import from {}", source);
            return 0;
        }

        List<StoredEntry> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        int expected = fileDimension(oldestFirst.get(0).getEmbedding().length);
        for (StoredEntry entry : oldestFirst) {
            BinaryFormat.checkKey(entry.getKey());
            if (entry.getEmbedding().length != expected) {
                throw new DimensionMismatchException(expected, entry.getEmbedding().length);
            }
        }

        prepareFile(expected, expected);
        BinaryFormat.writeRecords(storePath, oldestFirst);
        log.info("Imported {} entries from {} into {}", oldestFirst.size(), source, storePath);
        return oldestFirst.size();
    }

    public float[] generateEmbedding(String text) {
        return getOrInitProvider().embed(text);
    }

    /**
     * Drops the memoized provider, closing it if it holds resources.
     * A later call that needs embeddings creates a new one.
     */
    public void dispose() {
        EmbeddingService released;
        synchronized (this) {
            released = provider;
            provider = null;
        }
        if (released instanceof AutoCloseable) {
            try {
                ((AutoCloseable) released).close();
            } catch (Exception e) {
                log.warn("Failed to close embedding provider: {}", e.getMessage(), e);
            }
        }
    }

    synchronized EmbeddingService getOrInitProvider() {
        if (provider == null) {
            provider = providerFactory.get();
            if (provider == null) {
                throw new EmbeddingProviderException("No embedding provider available");
            }
            log.info("Initialized embedding provider {}", provider.getClass().getSimpleName());
        }
        return provider;
    }

    /**
     * @return the dimension of the existing file, or {@code proposed} when there is no file yet
     */
    private int fileDimension(int proposed) throws IOException {
        return Files.exists(storePath) ? BinaryFormat.readHeader(storePath).getDimension() : proposed;
    }

    /**
     * Writes the header when the file is missing. Otherwise checks the file's
     * dimension and removes an interrupted record left at the end.
     */
    private void prepareFile(int fileDimension, int dimension) throws IOException {
        if (fileDimension != dimension) {
            throw new DimensionMismatchException(fileDimension, dimension);
        }
        if (!Files.exists(storePath)) {
            BinaryFormat.writeHeader(storePath, dimension);
            return;
        }
        BinaryFormat.truncateIncompleteTail(storePath, dimension);
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key must be provided.");
        }
    }
}
