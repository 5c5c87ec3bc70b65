package com.semsearch.index;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.semsearch.error.SemanticSearchException;
import com.semsearch.ingest.DocumentChunk;

/**
 * Exact index persisted as JSON. Each index owns the directory {@code <indexRoot>/<index id>}
 * holding one {@code index-<generation>.json} per build (chunks with their vectors) and
 * {@code metadata.json}, which names the current generation through its creation time.
 *
 * <p>A persist writes the new generation file first and then replaces {@code metadata.json},
 * both through a temporary sibling and an atomic move. Until the metadata move, readers and
 * later processes keep seeing the previous generation intact; superseded files are removed
 * only afterwards.
 */
public class LocalJsonVectorIndex extends InMemoryVectorIndex {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorIndex.class);

    static final String INDEX_FILE_PREFIX = "index-";
    static final String INDEX_FILE_SUFFIX = ".json";
    static final String METADATA_FILE = "metadata.json";

    private static final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public LocalJsonVectorIndex(IndexId id) {
        super(id);
    }

    @Override
    public void persist(Path indexRoot) {
        Snapshot snapshot = requireSnapshot();
        List<IndexedChunk> entries = new ArrayList<>(snapshot.chunks().size());
        for (int i = 0; i < snapshot.chunks().size(); i++) {
            entries.add(new IndexedChunk(snapshot.chunks().get(i), snapshot.vectors()[i]));
        }
        Path directory = directoryFor(indexRoot, id());
        Path indexFile = directory.resolve(indexFileName(snapshot.metadata()));
        try {
            BackendIo.withRetry("Writing index " + id() + " to " + directory, () -> {
                Files.createDirectories(directory);
                writeAtomically(indexFile, entries, false);
                writeAtomically(directory.resolve(METADATA_FILE), snapshot.metadata(), true);
                return null;
            });
        } catch (SemanticSearchException e) {
            discardUncommitted(indexFile);
            throw e;
        }
        removeSupersededGenerations(directory, indexFile.getFileName().toString());
        log.info("Persisted index {} ({} chunks) to {}", id(), entries.size(), indexFile);
    }

    public static Path directoryFor(Path indexRoot, IndexId id) {
        return indexRoot.resolve(id.value());
    }

    /**
     * File name of the generation described by {@code metadata}.
     */
    static String indexFileName(IndexMetadata metadata) {
        Instant createdAt = metadata.createdAt();
        if (createdAt == null) {
            throw SemanticSearchException.backendIo("Index " + metadata.indexId() + " metadata has no created_at", null);
        }
        return INDEX_FILE_PREFIX + createdAt.getEpochSecond() + "-" + createdAt.getNano() + INDEX_FILE_SUFFIX;
    }

    /**
     * Restores a persisted index, or returns empty when none was ever written for {@code id}.
     */
    public static Optional<LocalJsonVectorIndex> load(Path indexRoot, IndexId id) {
        Path directory = directoryFor(indexRoot, id);
        Path metadataFile = directory.resolve(METADATA_FILE);
        if (!Files.exists(metadataFile)) {
            return Optional.empty();
        }

        IndexMetadata metadata = readMetadata(metadataFile);
        List<IndexedChunk> entries;
        try {
            entries = readEntries(id, directory.resolve(indexFileName(metadata)));
        } catch (SemanticSearchException e) {
            if (!(e.getCause() instanceof NoSuchFileException)) {
                throw e;
            }
            // replaced by a concurrent persist between the two reads
            log.debug("Index {} was replaced while loading; reading the new generation", id);
            metadata = readMetadata(metadataFile);
            entries = readEntries(id, directory.resolve(indexFileName(metadata)));
        }

        if (!id.model().id().equals(metadata.modelId()) || !id.backend().id().equals(metadata.backendId())) {
            throw SemanticSearchException.backendIo("Index " + id + " metadata names model " + metadata.modelId()
                    + " and backend " + metadata.backendId(), null);
        }
        if (entries.isEmpty() || entries.size() != metadata.chunkCount()) {
            throw SemanticSearchException.backendIo("Index " + id + " holds " + entries.size()
                    + " chunks but its metadata records " + metadata.chunkCount(), null);
        }
        List<DocumentChunk> chunks = new ArrayList<>(entries.size());
        List<float[]> vectors = new ArrayList<>(entries.size());
        for (IndexedChunk entry : entries) {
            if (entry.embedding() == null || entry.embedding().length != metadata.dimension()) {
                throw SemanticSearchException.backendIo("Index " + id + " chunk " + entry.chunk().id()
                        + " does not have " + metadata.dimension() + " dimensions", null);
            }
            chunks.add(entry.chunk());
            vectors.add(entry.embedding());
        }

        LocalJsonVectorIndex index = new LocalJsonVectorIndex(id);
        index.install(chunks, vectors, metadata);
        log.info("Loaded index {} ({} chunks, {} dimensions) from {}", id, chunks.size(), metadata.dimension(), directory);
        return Optional.of(index);
    }

    public static IndexMetadata readMetadata(Path metadataFile) {
        return BackendIo.withRetry("Reading index metadata " + metadataFile,
                () -> objectMapper.readValue(metadataFile.toFile(), IndexMetadata.class));
    }

    public static boolean exists(Path indexRoot, IndexId id) {
        return Files.exists(directoryFor(indexRoot, id).resolve(METADATA_FILE));
    }

    public static void delete(Path indexRoot, IndexId id) {
        Path directory = directoryFor(indexRoot, id);
        if (!Files.exists(directory)) {
            return;
        }
        BackendIo.withRetry("Deleting index " + id, () -> {
            // metadata first so a half-deleted directory no longer counts as an index
            Files.deleteIfExists(directory.resolve(METADATA_FILE));
            try (Stream<Path> paths = Files.walk(directory)) {
                for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(path);
                }
            }
            return null;
        });
        log.info("Deleted persisted index {} at {}", id, directory);
    }

    private static void writeAtomically(Path target, Object value, boolean pretty) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        if (pretty) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
        } else {
            objectMapper.writeValue(temp.toFile(), value);
        }
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static List<IndexedChunk> readEntries(IndexId id, Path indexFile) {
        return BackendIo.withRetry("Reading index " + id + " from " + indexFile, () -> {
            try (InputStream in = Files.newInputStream(indexFile)) {
                return objectMapper.readValue(in, new TypeReference<List<IndexedChunk>>() {
                });
            }
        });
    }

    private void discardUncommitted(Path indexFile) {
        try {
            Files.deleteIfExists(indexFile.resolveSibling(indexFile.getFileName() + ".tmp"));
            Files.deleteIfExists(indexFile);
        } catch (IOException e) {
            log.warn("Unable to remove uncommitted index file {}: {}", indexFile, e.getMessage());
        }
    }

    private void removeSupersededGenerations(Path directory, String current) {
        try (Stream<Path> files = Files.list(directory)) {
            List<Path> superseded = files
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.startsWith(INDEX_FILE_PREFIX) && name.endsWith(INDEX_FILE_SUFFIX) && !name.equals(current);
                    })
                    .toList();
            for (Path path : superseded) {
                Files.deleteIfExists(path);
                log.debug("Removed superseded generation {}", path);
            }
        } catch (IOException e) {
            log.warn("Unable to remove superseded generations of index {} in {}: {}", id(), directory, e.getMessage());
        }
    }

    public record IndexedChunk(DocumentChunk chunk, float[] embedding) {
    }
}
