package com.semsearch.index;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.embedding.Vectors;
import com.semsearch.error.ErrorKind;
import com.semsearch.error.SemanticSearchException;
import com.semsearch.ingest.DocumentChunk;

/**
 * Exact index: vectors are normalised once at build time and every search is a linear scan of
 * dot products. Content lives in an immutable snapshot that {@link #build} swaps in whole, so a
 * search always runs against a single generation.
 */
public class InMemoryVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    // worst candidate first: lowest score, then latest insertion
    private static final Comparator<Candidate> WORST_FIRST = Comparator
            .<Candidate>comparingDouble(Candidate::score)
            .thenComparing(Comparator.<Candidate>comparingInt(Candidate::position).reversed());

    private final IndexId id;
    private volatile Snapshot snapshot;

    public InMemoryVectorIndex(IndexId id) {
        this.id = id;
    }

    @Override
    public IndexId id() {
        return id;
    }

    @Override
    public void build(List<DocumentChunk> chunks, List<float[]> vectors) {
        if (chunks == null || chunks.isEmpty()) {
            throw new SemanticSearchException(ErrorKind.EMPTY_INPUT, "Cannot build index " + id + " from zero chunks");
        }
        if (vectors == null || vectors.size() != chunks.size()) {
            throw SemanticSearchException.invalidConfiguration("Index " + id + " received " + chunks.size()
                    + " chunks but " + (vectors == null ? 0 : vectors.size()) + " vectors");
        }
        int documentCount = (int) chunks.stream().map(chunk -> chunk.metadata().sourceDocument()).distinct().count();
        int dimension = vectors.get(0).length;
        IndexMetadata metadata = new IndexMetadata(id.value(), id.model().id(), id.backend().id(),
                dimension, chunks.size(), documentCount, Instant.now());
        install(chunks, vectors, metadata);
    }

    /**
     * Validates and normalises the vectors, then publishes them as the current snapshot.
     */
    protected final void install(List<DocumentChunk> chunks, List<float[]> vectors, IndexMetadata metadata) {
        int dimension = metadata.dimension();
        float[][] normalized = new float[vectors.size()][];
        for (int i = 0; i < vectors.size(); i++) {
            float[] vector = vectors.get(i);
            if (vector.length != dimension) {
                log.error("Index {} chunk {} has {} dimensions, expected {}", id, chunks.get(i).id(), vector.length, dimension);
                throw SemanticSearchException.dimensionMismatch(dimension, vector.length);
            }
            normalized[i] = Vectors.normalized(vector);
        }
        this.snapshot = new Snapshot(List.copyOf(chunks), normalized, metadata);
    }

    @Override
    public List<SearchResult> search(float[] queryVector, int topK) {
        if (topK < 1) {
            throw new SemanticSearchException(ErrorKind.INVALID_TOP_K, "top_k must be at least 1, got " + topK);
        }
        Snapshot current = requireSnapshot();
        int dimension = current.metadata().dimension();
        if (queryVector.length != dimension) {
            log.error("Query vector for index {} has {} dimensions, expected {}", id, queryVector.length, dimension);
            throw SemanticSearchException.dimensionMismatch(dimension, queryVector.length);
        }

        float[] query = Vectors.normalized(queryVector);
        PriorityQueue<Candidate> best = new PriorityQueue<>(Math.min(topK, current.vectors().length) + 1, WORST_FIRST);
        for (int position = 0; position < current.vectors().length; position++) {
            Candidate candidate = new Candidate(position, Vectors.dot(query, current.vectors()[position]));
            if (best.size() < topK) {
                best.add(candidate);
            } else if (WORST_FIRST.compare(candidate, best.peek()) > 0) {
                best.poll();
                best.add(candidate);
            }
        }

        List<Candidate> ordered = new ArrayList<>(best);
        ordered.sort(WORST_FIRST.reversed());
        List<SearchResult> results = new ArrayList<>(ordered.size());
        for (Candidate candidate : ordered) {
            results.add(new SearchResult(current.chunks().get(candidate.position()), candidate.score()));
        }
        return results;
    }

    @Override
    public int dimension() {
        return requireSnapshot().metadata().dimension();
    }

    @Override
    public int size() {
        Snapshot current = snapshot;
        return current == null ? 0 : current.chunks().size();
    }

    @Override
    public IndexMetadata metadata() {
        return requireSnapshot().metadata();
    }

    @Override
    public void persist(Path indexRoot) {
        log.debug("Index {} uses the {} backend; nothing to persist", id, id.backend().id());
    }

    protected Snapshot requireSnapshot() {
        Snapshot current = snapshot;
        if (current == null) {
            throw SemanticSearchException.indexNotFound(id.value());
        }
        return current;
    }

    protected record Snapshot(List<DocumentChunk> chunks, float[][] vectors, IndexMetadata metadata) {
    }

    private record Candidate(int position, float score) {
    }
}
