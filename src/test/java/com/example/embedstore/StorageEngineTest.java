package com.example.embedstore;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

public class StorageEngineTest {

    private static final String FOX = "The quick brown fox";
    private static final String ML = "Machine learning is fun";
    private static final String FOX2 = "A fast auburn fox";

    @TempDir
    Path tempDir;

    private final FixedEmbeddingService provider = new FixedEmbeddingService()
            .with(FOX, 1f, 0f, 0f)
            .with(ML, 0f, 1f, 0f)
            .with(FOX2, 0f, 0f, 1f);

    @Test
    public void latestStoreWinsAndSearchRanksBySimilarity() throws Exception {
        StorageEngine engine = new StorageEngine(tempDir.resolve("store.raptor"), () -> provider);

        engine.store("doc1", FOX);
        engine.store("doc2", ML);
        engine.store("doc1", FOX2);

        StoredEntry doc1 = engine.get("doc1").orElseThrow();
        assertThat(doc1.getEmbedding()).containsExactly(0f, 0f, 1f);
        assertThat(engine.get("doc2").orElseThrow().getEmbedding()).containsExactly(0f, 1f, 0f);

        List<SearchResult> top = engine.search(FOX2, 1, 0);
        assertThat(top).hasSize(1);
        assertThat(top.get(0).getKey()).isEqualTo("doc1");
        assertThat(top.get(0).getSimilarity()).isCloseTo(1.0, within(1e-9));

        List<SearchResult> all = engine.search(FOX2, 10, 0);
        assertThat(all).extracting(SearchResult::getKey).containsExactly("doc1", "doc2");
        assertThat(all.get(1).getSimilarity()).isEqualTo(0.0);
    }

    @Test
    public void defaultSearchUsesHalfSimilarityThreshold() throws Exception {
        StorageEngine engine = new StorageEngine(tempDir.resolve("store.raptor"), () -> provider);
        engine.store("doc1", FOX);
        engine.store("doc2", ML);

        assertThat(engine.search(FOX)).extracting(SearchResult::getKey).containsExactly("doc1");
    }

    @Test
    public void storeCreatesHeaderWithProviderDimension() throws Exception {
        Path file = tempDir.resolve("sub/store.raptor");
        StorageEngine engine = new StorageEngine(file, () -> provider);

        engine.store("doc1", FOX);

        assertThat(BinaryFormat.readHeader(file)).isEqualTo(new FileHeader(1, 3));
        assertThat(Files.size(file)).isEqualTo(BinaryFormat.HEADER_SIZE + BinaryFormat.recordLength(4, 3));
    }

    @Test
    public void storeManyEmbedsOnceAndWritesEveryRecord() throws Exception {
        Path file = tempDir.resolve("store.raptor");
        StorageEngine engine = new StorageEngine(file, () -> provider);

        engine.storeMany(List.of(new StoreItem("a", FOX), new StoreItem("bb", ML), new StoreItem("ccc", FOX2)));

        assertThat(provider.batchCalls).isEqualTo(1);
        assertThat(Files.size(file)).isEqualTo(BinaryFormat.HEADER_SIZE
                + BinaryFormat.recordLength(1, 3) + BinaryFormat.recordLength(2, 3) + BinaryFormat.recordLength(3, 3));
        assertThat(engine.get("bb").orElseThrow().getEmbedding()).containsExactly(0f, 1f, 0f);
    }

    @Test
    public void storeManyWithRepeatedKeyKeepsLastItem() throws Exception {
        StorageEngine engine = new StorageEngine(tempDir.resolve("store.raptor"), () -> provider);

        engine.storeMany(List.of(new StoreItem("k", FOX), new StoreItem("k", ML)));

        assertThat(engine.get("k").orElseThrow().getEmbedding()).containsExactly(0f, 1f, 0f);
    }

    @Test
    public void storeManyRejectsEmptyBatch() {
        StorageEngine engine = new StorageEngine(tempDir.resolve("store.raptor"), () -> provider);

        assertThatThrownBy(() -> engine.storeMany(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Items array must not be empty.");
    }

    @Test
    public void storeManyRejectsWrongNumberOfVectors() {
        Path file = tempDir.resolve("store.raptor");
        EmbeddingService shortProvider = texts -> List.of(new float[]{1f, 0f});
        StorageEngine engine = new StorageEngine(file, () -> shortProvider);

        assertThatThrownBy(() -> engine.storeMany(List.of(new StoreItem("a", "x"), new StoreItem("b", "y"))))
                .isInstanceOf(IllegalStateException.class);
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    public void rejectsInvalidArguments() {
        StorageEngine engine = new StorageEngine(tempDir.resolve("store.raptor"), () -> provider);

        assertThatThrownBy(() -> engine.get("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.store("", FOX)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.search("", 5, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Query text must be provided.");
        assertThatThrownBy(() -> engine.search(FOX, 0, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Limit must be a positive integer.");
        assertThatThrownBy(() -> engine.search(FOX, 5, 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("minSimilarity must be between 0 and 1.");
        assertThatThrownBy(() -> engine.search(FOX, 5, -0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void missingFileReadsEmptyWithoutStartingProvider() throws Exception {
        AtomicInteger created = new AtomicInteger();
        StorageEngine engine = new StorageEngine(tempDir.resolve("none.raptor"), () -> {
            created.incrementAndGet();
            return provider;
        });

        assertThat(engine.get("doc1")).isEmpty();
        assertThat(engine.search(FOX, 5, 0)).isEmpty();
        assertThat(created.get()).isZero();
    }

    @Test
    public void unknownKeyIsEmpty() throws Exception {
        StorageEngine engine = new StorageEngine(tempDir.resolve("store.raptor"), () -> provider);
        engine.store("doc1", FOX);

        assertThat(engine.get("nope")).isEmpty();
    }

    @Test
    public void rejectsVectorsOfAnotherDimension() throws Exception {
        Path file = tempDir.resolve("store.raptor");
        BinaryFormat.writeHeader(file, 4);
        StorageEngine engine = new StorageEngine(file, () -> provider);

        assertThatThrownBy(() -> engine.store("doc1", FOX))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessage("Dimension mismatch: expected 4, got 3");
        assertThat(Files.size(file)).isEqualTo(BinaryFormat.HEADER_SIZE);
    }

    @Test
    public void corruptHeaderFailsReads() throws Exception {
        Path file = tempDir.resolve("store.raptor");
        Files.write(file, "definitely not a store file".getBytes());
        StorageEngine engine = new StorageEngine(file, () -> provider);

        assertThatThrownBy(() -> engine.get("doc1")).isInstanceOf(InvalidFormatException.class);
        assertThatThrownBy(() -> engine.search(FOX, 5, 0)).isInstanceOf(InvalidFormatException.class);
    }

    @Test
    public void interruptedAppendKeepsEarlierRecordsReadable() throws Exception {
        Path file = tempDir.resolve("store.raptor");
        StorageEngine engine = new StorageEngine(file, () -> provider);
        engine.store("a", FOX);
        Files.write(file, new byte[]{3, 0, 'a', 'b', 'c'}, StandardOpenOption.APPEND);

        assertThat(engine.get("a").orElseThrow().getEmbedding()).containsExactly(1f, 0f, 0f);
        assertThat(engine.search(FOX, 5, 0.5)).extracting(SearchResult::getKey).containsExactly("a");
    }

    @Test
    public void storeAfterInterruptedAppendDropsTheLeftoverBytes() throws Exception {
        Path file = tempDir.resolve("store.raptor");
        StorageEngine engine = new StorageEngine(file, () -> provider);
        engine.store("a", FOX);
        long complete = Files.size(file);
        Files.write(file, new byte[]{3, 0, 'a', 'b', 'c'}, StandardOpenOption.APPEND);

        engine.store("b", ML);

        assertThat(Files.size(file)).isEqualTo(complete + BinaryFormat.recordLength(1, 3));
        assertThat(engine.get("a")).isPresent();
        assertThat(engine.get("b").orElseThrow().getEmbedding()).containsExactly(0f, 1f, 0f);
    }

    @Test
    public void rejectedFirstStoreLeavesNoFile() {
        Path file = tempDir.resolve("store.raptor");
        StorageEngine engine = new StorageEngine(file, () -> provider);

        assertThatThrownBy(() -> engine.store("k".repeat(BinaryFormat.MAX_KEY_LENGTH + 1), FOX))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    public void rejectedFirstBatchLeavesNoFile() {
        Path file = tempDir.resolve("store.raptor");
        EmbeddingService mixed = texts -> List.of(new float[]{1f, 0f, 0f}, new float[]{1f, 0f});
        StorageEngine engine = new StorageEngine(file, () -> mixed);

        assertThatThrownBy(() -> engine.storeMany(List.of(new StoreItem("a", "x"), new StoreItem("b", "y"))))
                .isInstanceOf(DimensionMismatchException.class);
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    public void providerIsCreatedOnceUntilDisposed() throws Exception {
        AtomicInteger created = new AtomicInteger();
        StorageEngine engine = new StorageEngine(tempDir.resolve("store.raptor"), () -> {
            created.incrementAndGet();
            return provider;
        });
        assertThat(created.get()).isZero();

        engine.store("doc1", FOX);
        engine.store("doc2", ML);
        engine.search(FOX, 5, 0);
        assertThat(created.get()).isEqualTo(1);

        engine.dispose();
        engine.generateEmbedding(FOX);
        assertThat(created.get()).isEqualTo(2);
    }

    @Test
    public void disposeClosesCloseableProvider() throws Exception {
        EmbeddingService closeable = mock(EmbeddingService.class, withSettings().extraInterfaces(AutoCloseable.class));
        when(closeable.embed(anyList())).thenReturn(List.of(new float[]{1f, 2f}));
        StorageEngine engine = new StorageEngine(tempDir.resolve("store.raptor"), () -> closeable);

        engine.dispose();
        engine.getOrInitProvider();
        engine.dispose();

        verify((AutoCloseable) closeable).close();
    }

    @Test
    public void nullProviderIsReported() {
        StorageEngine engine = new StorageEngine(tempDir.resolve("store.raptor"), () -> null);

        assertThatThrownBy(() -> engine.generateEmbedding("x")).isInstanceOf(EmbeddingProviderException.class);
    }

    @Test
    public void importsNewestJsonLinePerKeyOldestFirst() throws Exception {
        Path jsonl = tempDir.resolve("legacy.jsonl");
        Files.writeString(jsonl, String.join("\n",
                "{\"key\":\"a\",\"text\":\"one\",\"embedding\":[1,0,0],\"timestamp\":1}",
                "{\"key\":\"b\",\"text\":\"two\",\"embedding\":[0,1,0],\"timestamp\":2}",
                "{\"key\":\"a\",\"text\":\"three\",\"embedding\":[0,0,1],\"timestamp\":3}",
                ""));
        Path file = tempDir.resolve("store.raptor");
        AtomicInteger created = new AtomicInteger();
        StorageEngine engine = new StorageEngine(file, () -> {
            created.incrementAndGet();
            return provider;
        });

        assertThat(engine.importJsonLines(jsonl)).isEqualTo(2);

        assertThat(created.get()).isZero();
        assertThat(engine.get("a").orElseThrow().getEmbedding()).containsExactly(0f, 0f, 1f);
        assertThat(engine.get("b").orElseThrow().getEmbedding()).containsExactly(0f, 1f, 0f);
        // b was written first, so the newest record in the file is a
        BinaryRecord first = BinaryFormat.readRecordForward(file, 3, BinaryFormat.HEADER_SIZE).orElseThrow();
        assertThat(first.getKey()).isEqualTo("b");
    }

    @Test
    public void importRejectsEntriesOfAnotherDimension() throws Exception {
        Path jsonl = tempDir.resolve("legacy.jsonl");
        Files.writeString(jsonl, "{\"key\":\"a\",\"embedding\":[1,0]}\n");
        Path file = tempDir.resolve("store.raptor");
        BinaryFormat.writeHeader(file, 3);
        StorageEngine engine = new StorageEngine(file, () -> provider);

        assertThatThrownBy(() -> engine.importJsonLines(jsonl)).isInstanceOf(DimensionMismatchException.class);
        assertThat(Files.size(file)).isEqualTo(BinaryFormat.HEADER_SIZE);
    }

    @Test
    public void importOfMissingFileImportsNothing() throws Exception {
        Path file = tempDir.resolve("store.raptor");
        StorageEngine engine = new StorageEngine(file, () -> provider);

        assertThat(engine.importJsonLines(tempDir.resolve("absent.jsonl"))).isZero();
        assertThat(Files.exists(file)).isFalse();
    }

    private static final class FixedEmbeddingService implements EmbeddingService {
        private final Map<String, float[]> vectors = new HashMap<>();
        int batchCalls;

        FixedEmbeddingService with(String text, float... vector) {
            vectors.put(text, vector);
            return this;
        }

        @Override
        public List<float[]> embed(List<String> texts) {
            batchCalls++;
            List<float[]> out = new ArrayList<>();
            for (String t : texts) {
                float[] v = vectors.get(t);
                if (v == null) throw new EmbeddingProviderException("no vector for " + t);
                out.add(v);
            }
            return out;
        }
    }
}
