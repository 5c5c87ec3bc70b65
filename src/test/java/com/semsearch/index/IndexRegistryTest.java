package com.semsearch.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.semsearch.embedding.EmbeddingModel;
import com.semsearch.embedding.EmbeddingModelRegistry;
import com.semsearch.embedding.EmbeddingService;
import com.semsearch.embedding.LocalModelEmbeddingService;
import com.semsearch.error.ErrorKind;
import com.semsearch.error.SemanticSearchException;
import com.semsearch.ingest.Chunker;
import com.semsearch.ingest.Document;
import com.semsearch.ingest.DocumentStore;
import com.semsearch.ingest.InMemoryDocumentStore;

class IndexRegistryTest {

    private static final String L6 = "sentence-transformers/all-MiniLM-L6-v2";

    @TempDir
    Path tempDir;

    @Test
    void shouldBuildPersistAndListIndex() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.add("animals.txt", "Cats are mammals. Dogs are mammals too.");
        store.add("weather.md", "Rain is expected tomorrow afternoon.");
        IndexRegistry registry = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir);

        BuildReport report = registry.build(L6, "local-json");

        assertEquals("local-json_all-MiniLM-L6-v2", report.indexId());
        assertEquals(2, report.documentsProcessed());
        assertEquals(2, report.chunksCreated());
        assertEquals(384, report.dimension());
        assertTrue(report.elapsedSeconds() >= 0);
        assertTrue(LocalJsonVectorIndex.exists(tempDir, IndexId.parse(report.indexId())));

        List<IndexMetadata> listed = registry.list();
        assertEquals(1, listed.size());
        assertEquals(report.indexId(), listed.get(0).indexId());
        assertEquals(2, listed.get(0).documentCount());

        IndexRegistry reopened = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir);
        assertEquals(1, reopened.list().size());
        VectorIndex loaded = reopened.resolve(report.indexId());
        assertEquals(2, loaded.size());
        assertTrue(reopened.isLoaded(loaded.id()));
    }

    @Test
    void shouldListExactIndexOnlyWhileLive() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.add("a.txt", "Some text to index.");
        IndexRegistry registry = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir);

        registry.build("paraphrase-MiniLM-L3-v2", "exact");

        assertEquals(List.of("exact_paraphrase-MiniLM-L3-v2"),
                registry.list().stream().map(IndexMetadata::indexId).toList());
        assertTrue(new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir).list().isEmpty());
    }

    @Test
    void shouldReportNeverBuiltIndexAsNotFound() {
        IndexRegistry registry = new IndexRegistry(new InMemoryDocumentStore(), new EmbeddingModelRegistry(),
                new Chunker(), tempDir);

        for (String id : List.of("local-json_all-MiniLM-L6-v2", "exact_all-mpnet-base-v2", "bogus", "faiss_all-MiniLM-L6-v2")) {
            SemanticSearchException e = assertThrows(SemanticSearchException.class, () -> registry.resolve(id));
            assertEquals(ErrorKind.INDEX_NOT_FOUND, e.kind(), id);
        }
        assertFalse(registry.isLoaded(IndexId.parse("local-json_all-MiniLM-L6-v2")));
    }

    @Test
    void shouldLoadIndexOnceForConcurrentResolves() throws Exception {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.add("a.txt", "Concurrent loading should happen exactly once.");
        new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir).build(L6, "local-json");

        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        IndexRegistry registry = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir) {
            @Override
            protected VectorIndex load(IndexId id) {
                loads.incrementAndGet();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.load(id);
            }
        };

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<VectorIndex>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> registry.resolve("local-json_all-MiniLM-L6-v2")));
            }
            Thread.sleep(100);
            release.countDown();
            VectorIndex first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<VectorIndex> future : futures) {
                assertSame(first, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, loads.get());
    }

    @Test
    void shouldRetryLoadAfterFailure() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.add("a.txt", "Retry after a failed load.");
        IndexRegistry registry = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir);

        assertThrows(SemanticSearchException.class, () -> registry.resolve("local-json_all-MiniLM-L6-v2"));
        new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir).build(L6, "local-json");

        assertEquals(1, registry.resolve("local-json_all-MiniLM-L6-v2").size());
    }

    @Test
    void shouldExposeOnlyWholeGenerationsDuringRebuild() throws Exception {
        AtomicReference<List<Document>> generation = new AtomicReference<>(documents("old", 3));
        DocumentStore store = generation::get;
        IndexRegistry registry = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir);
        registry.build(L6, "exact");
        IndexId id = IndexId.parse("exact_all-MiniLM-L6-v2");
        float[] query = new LocalModelEmbeddingService(EmbeddingModel.ALL_MINILM_L6_V2).embed("document number");

        AtomicBoolean running = new AtomicBoolean(true);
        AtomicReference<String> violation = new AtomicReference<>();
        Thread searcher = new Thread(() -> {
            while (running.get()) {
                List<SearchResult> results = registry.resolve(id).search(query, 10);
                long distinctGenerations = results.stream()
                        .map(result -> result.chunk().metadata().sourceDocument().split("-")[0])
                        .distinct()
                        .count();
                if (distinctGenerations != 1) {
                    violation.set("mixed generations: " + results);
                }
            }
        });
        searcher.start();
        generation.set(documents("new", 5));
        registry.build(id);
        Thread.sleep(50);
        running.set(false);
        searcher.join(5000);

        assertNull(violation.get());
        List<SearchResult> after = registry.resolve(id).search(query, 10);
        assertEquals(5, after.size());
        assertTrue(after.stream().allMatch(result -> result.chunk().metadata().sourceDocument().startsWith("new-")));
    }

    @Test
    void shouldKeepPreviousIndexWhenRebuildFails() {
        AtomicReference<List<Document>> generation = new AtomicReference<>(documents("old", 2));
        AtomicBoolean failEmbedding = new AtomicBoolean(false);
        EmbeddingModelRegistry models = new EmbeddingModelRegistry(model -> new EmbeddingService() {
            private final LocalModelEmbeddingService delegate = new LocalModelEmbeddingService(model);

            @Override
            public EmbeddingModel model() {
                return model;
            }

            @Override
            public float[] embed(String text) {
                if (failEmbedding.get()) {
                    throw new SemanticSearchException(ErrorKind.MODEL_UNAVAILABLE, "embedding backend down");
                }
                return delegate.embed(text);
            }
        });
        IndexRegistry registry = new IndexRegistry(generation::get, models, new Chunker(), tempDir);
        BuildReport first = registry.build(L6, "local-json");

        generation.set(documents("new", 4));
        failEmbedding.set(true);
        SemanticSearchException e = assertThrows(SemanticSearchException.class, () -> registry.build(L6, "local-json"));
        assertEquals(ErrorKind.MODEL_UNAVAILABLE, e.kind());

        failEmbedding.set(false);
        assertEquals(2, registry.resolve(first.indexId()).size());
        assertEquals(2, LocalJsonVectorIndex.load(tempDir, IndexId.parse(first.indexId())).orElseThrow().size());
    }

    @Test
    void shouldKeepPersistedIndexWhenRebuildCannotBeWritten() throws Exception {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.add("a.txt", "First document about cats.");
        store.add("b.txt", "Second document about dogs.");
        IndexRegistry registry = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir);
        BuildReport first = registry.build(L6, "local-json");
        IndexId id = IndexId.parse(first.indexId());

        store.add("c.txt", "Third document about birds.");
        Files.createDirectories(LocalJsonVectorIndex.directoryFor(tempDir, id).resolve("metadata.json.tmp"));
        SemanticSearchException e = assertThrows(SemanticSearchException.class, () -> registry.build(id));

        assertEquals(ErrorKind.BACKEND_IO, e.kind());
        assertEquals(2, registry.resolve(id).size());
        IndexRegistry fresh = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir);
        VectorIndex reloaded = fresh.resolve(id);
        assertEquals(2, reloaded.size());
        assertEquals(2, reloaded.metadata().documentCount());
        assertEquals(2, fresh.list().get(0).chunkCount());
    }

    @Test
    void shouldRejectBuildWithoutChunks() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.add("empty.txt", "");
        IndexRegistry registry = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir);

        SemanticSearchException e = assertThrows(SemanticSearchException.class, () -> registry.build(L6, "exact"));

        assertEquals(ErrorKind.EMPTY_INPUT, e.kind());
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void shouldFailFastOnUnsupportedVariants() {
        AtomicInteger listings = new AtomicInteger();
        DocumentStore store = () -> {
            listings.incrementAndGet();
            return List.of();
        };
        IndexRegistry registry = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir);

        SemanticSearchException model = assertThrows(SemanticSearchException.class,
                () -> registry.build("sentence-transformers/unknown-model", "exact"));
        SemanticSearchException backend = assertThrows(SemanticSearchException.class,
                () -> registry.build(L6, "faiss"));

        assertEquals(ErrorKind.MODEL_UNAVAILABLE, model.kind());
        assertEquals(ErrorKind.INVALID_CONFIGURATION, backend.kind());
        assertEquals(0, listings.get());
    }

    @Test
    void shouldRemoveIndexFromMemoryAndDisk() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.add("a.txt", "Index that will be removed.");
        IndexRegistry registry = new IndexRegistry(store, new EmbeddingModelRegistry(), new Chunker(), tempDir);
        IndexId id = IndexId.parse(registry.build(L6, "local-json").indexId());

        assertTrue(registry.remove(id));

        assertFalse(registry.isLoaded(id));
        assertFalse(LocalJsonVectorIndex.exists(tempDir, id));
        assertTrue(registry.list().isEmpty());
        assertFalse(registry.remove(id));
        SemanticSearchException e = assertThrows(SemanticSearchException.class, () -> registry.resolve(id));
        assertEquals(ErrorKind.INDEX_NOT_FOUND, e.kind());
    }

    private static List<Document> documents(String generation, int count) {
        List<Document> documents = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String text = "Document number " + i + " of the " + generation + " generation.";
            documents.add(new Document(generation + "-" + i + ".txt", text, text.length()));
        }
        return documents;
    }
}
