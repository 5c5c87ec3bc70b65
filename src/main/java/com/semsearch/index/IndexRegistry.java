package com.semsearch.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.embedding.EmbeddingModel;
import com.semsearch.embedding.EmbeddingModelRegistry;
import com.semsearch.embedding.EmbeddingService;
import com.semsearch.error.ErrorKind;
import com.semsearch.error.SemanticSearchException;
import com.semsearch.ingest.Chunker;
import com.semsearch.ingest.Document;
import com.semsearch.ingest.DocumentChunk;
import com.semsearch.ingest.DocumentStore;

/**
 * Tracks materialised indices and hands out live instances.
 *
 * <p>Live instances are cached as futures: the first {@link #resolve} of an id loads it from
 * disk while concurrent callers for the same id wait on the same future. A {@link #build}
 * assembles a complete new instance before swapping it into the cache, so searches keep using
 * the previous instance until the swap and a failed build leaves it in place.
 */
public class IndexRegistry {
    private static final Logger log = LoggerFactory.getLogger(IndexRegistry.class);

    private final DocumentStore documentStore;
    private final EmbeddingModelRegistry models;
    private final Chunker chunker;
    private final Path indexRoot;
    private final Map<IndexId, CompletableFuture<VectorIndex>> live = new ConcurrentHashMap<>();
    private final Map<IndexId, Object> buildLocks = new ConcurrentHashMap<>();

    public IndexRegistry(DocumentStore documentStore, EmbeddingModelRegistry models, Chunker chunker, Path indexRoot) {
        this.documentStore = documentStore;
        this.models = models;
        this.chunker = chunker;
        this.indexRoot = indexRoot;
    }

    /**
     * All built indices, live ones and those persisted below the index root, ordered by id.
     */
    public List<IndexMetadata> list() {
        Map<String, IndexMetadata> byId = new TreeMap<>();
        for (IndexMetadata metadata : persistedMetadata()) {
            byId.put(metadata.indexId(), metadata);
        }
        for (CompletableFuture<VectorIndex> future : live.values()) {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                IndexMetadata metadata = future.join().metadata();
                byId.put(metadata.indexId(), metadata);
            }
        }
        return new ArrayList<>(byId.values());
    }

    public VectorIndex resolve(String indexId) {
        return resolve(IndexId.parse(indexId));
    }

    public VectorIndex resolve(IndexId id) {
        CompletableFuture<VectorIndex> future = live.get(id);
        if (future == null) {
            CompletableFuture<VectorIndex> pending = new CompletableFuture<>();
            future = live.putIfAbsent(id, pending);
            if (future == null) {
                future = pending;
                try {
                    pending.complete(load(id));
                } catch (RuntimeException e) {
                    live.remove(id, pending);
                    pending.completeExceptionally(e);
                }
            }
        }
        return await(future);
    }

    public BuildReport build(String modelId, String backendId) {
        EmbeddingModel model = EmbeddingModel.fromId(modelId);
        IndexBackend backend = IndexBackend.fromId(backendId);
        return build(new IndexId(model, backend));
    }

    public BuildReport build(IndexId id) {
        synchronized (buildLocks.computeIfAbsent(id, unused -> new Object())) {
            long start = System.nanoTime();
            List<Document> documents = documentStore.listDocuments();
            List<DocumentChunk> chunks = new ArrayList<>();
            for (Document document : documents) {
                chunks.addAll(chunker.chunk(document));
            }
            if (chunks.isEmpty()) {
                throw new SemanticSearchException(ErrorKind.EMPTY_INPUT,
                        "Nothing to index for " + id + ": " + documents.size() + " documents produced no chunks");
            }
            log.info("Building index {} from {} documents ({} chunks, chunkSize={}, overlap={})",
                    id, documents.size(), chunks.size(), chunker.chunkSize(), chunker.overlap());

            EmbeddingService embeddingService = models.get(id.model());
            List<float[]> vectors = embeddingService.embedAll(chunks.stream().map(DocumentChunk::text).toList());

            VectorIndex index = id.backend().create(id);
            index.build(chunks, vectors);
            if (index.isPersistent()) {
                index.persist(indexRoot);
            }
            live.put(id, CompletableFuture.completedFuture(index));

            double elapsedSeconds = (System.nanoTime() - start) / 1_000_000_000d;
            log.info("Index {} ready: chunks={} dimension={} elapsedSeconds={}",
                    id, chunks.size(), index.dimension(), String.format(Locale.ROOT, "%.3f", elapsedSeconds));
            return new BuildReport(id.value(), documents.size(), chunks.size(), index.dimension(), elapsedSeconds);
        }
    }

    /**
     * Drops an index from memory and disk.
     *
     * @return whether an index with that id existed
     */
    public boolean remove(IndexId id) {
        synchronized (buildLocks.computeIfAbsent(id, unused -> new Object())) {
            boolean existed = live.remove(id) != null;
            if (id.backend().persistent() && LocalJsonVectorIndex.exists(indexRoot, id)) {
                LocalJsonVectorIndex.delete(indexRoot, id);
                existed = true;
            }
            if (existed) {
                log.info("Removed index {}", id);
            }
            return existed;
        }
    }

    public boolean isLoaded(IndexId id) {
        CompletableFuture<VectorIndex> future = live.get(id);
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    /**
     * Loads persisted state for {@code id}; overridable so callers can observe or replace loading.
     */
    protected VectorIndex load(IndexId id) {
        if (!id.backend().persistent()) {
            throw SemanticSearchException.indexNotFound(id.value());
        }
        log.debug("Loading index {} from {}", id, indexRoot);
        return LocalJsonVectorIndex.load(indexRoot, id)
                .orElseThrow(() -> SemanticSearchException.indexNotFound(id.value()));
    }

    private List<IndexMetadata> persistedMetadata() {
        List<IndexMetadata> found = new ArrayList<>();
        if (!Files.isDirectory(indexRoot)) {
            return found;
        }
        List<Path> directories;
        try (Stream<Path> entries = Files.list(indexRoot)) {
            directories = entries.filter(Files::isDirectory).toList();
        } catch (IOException e) {
            throw SemanticSearchException.backendIo("Unable to list indices in " + indexRoot, e);
        }
        for (Path directory : directories) {
            Path metadataFile = directory.resolve(LocalJsonVectorIndex.METADATA_FILE);
            if (!Files.exists(metadataFile)) {
                continue;
            }
            try {
                found.add(LocalJsonVectorIndex.readMetadata(metadataFile));
            } catch (SemanticSearchException e) {
                log.warn("Skipping index directory {}: {}", directory, e.getMessage());
            }
        }
        return found;
    }

    private static VectorIndex await(CompletableFuture<VectorIndex> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
