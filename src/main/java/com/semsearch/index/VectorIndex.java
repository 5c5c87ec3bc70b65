package com.semsearch.index;

import java.nio.file.Path;
import java.util.List;

import com.semsearch.ingest.DocumentChunk;

/**
 * Nearest-neighbour index over chunk vectors of a single embedding model, scored by cosine
 * similarity. Once built, an index is read-only and may be searched concurrently.
 */
public interface VectorIndex {
    IndexId id();

    /**
     * Replaces all content with the given chunks and their vectors.
     *
     * @throws com.semsearch.error.SemanticSearchException {@code EMPTY_INPUT} when there are no
     *         chunks, {@code DIMENSION_MISMATCH} when vectors differ in length
     */
    void build(List<DocumentChunk> chunks, List<float[]> vectors);

    /**
     * Returns at most {@code topK} chunks by descending similarity; equal scores keep insertion
     * order.
     */
    List<SearchResult> search(float[] queryVector, int topK);

    int dimension();

    int size();

    IndexMetadata metadata();

    default IndexBackend backend() {
        return id().backend();
    }

    default boolean isPersistent() {
        return backend().persistent();
    }

    /**
     * Writes the index below {@code indexRoot}. A no-op for non-persistent backends.
     */
    void persist(Path indexRoot);
}
