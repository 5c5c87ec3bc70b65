package com.semsearch.query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.embedding.EmbeddingModelRegistry;
import com.semsearch.error.ErrorKind;
import com.semsearch.error.SemanticSearchException;
import com.semsearch.index.IndexRegistry;
import com.semsearch.index.SearchResult;
import com.semsearch.index.VectorIndex;

/**
 * Runs semantic queries against registered indices. A query is always embedded with the model
 * its target index was built with.
 */
public class QueryEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final IndexRegistry registry;
    private final EmbeddingModelRegistry models;
    private final ExecutorService workers;

    public QueryEngine(IndexRegistry registry, EmbeddingModelRegistry models, int workerThreads) {
        this.registry = registry;
        this.models = models;
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads));
    }

    public List<RankedResult> query(String text, String indexId, int topK) {
        validate(text, topK);
        long start = System.nanoTime();
        VectorIndex index = registry.resolve(indexId);
        float[] queryVector = models.get(index.id().model()).embed(text);
        List<SearchResult> hits = index.search(queryVector, topK);

        List<RankedResult> ranked = new ArrayList<>(hits.size());
        for (SearchResult hit : hits) {
            ranked.add(new RankedResult(
                    ranked.size() + 1,
                    hit.chunk().text(),
                    hit.chunk().metadata().sourceDocument(),
                    hit.chunk().metadata().chunkIndex(),
                    hit.score()));
        }
        log.debug("query index={} topK={} results={} elapsedMs={}",
                index.id(), topK, ranked.size(), (System.nanoTime() - start) / 1_000_000);
        return ranked;
    }

    /**
     * Like {@link #query(String, String, int)} but gives up after {@code timeout}. A search that
     * is already running finishes on its worker; its result is discarded.
     */
    public List<RankedResult> query(String text, String indexId, int topK, Duration timeout) {
        validate(text, topK);
        Future<List<RankedResult>> future = workers.submit(() -> query(text, indexId, topK));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            log.warn("Query against {} timed out after {} ms", indexId, timeout.toMillis());
            throw new SemanticSearchException(ErrorKind.QUERY_TIMEOUT,
                    "Query did not complete within " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SemanticSearchException(ErrorKind.QUERY_TIMEOUT, "Query interrupted", e);
        }
    }

    /**
     * Runs every query independently. The returned list has one outcome per input text, in input
     * order; a failed query is reported in its own slot and does not affect the others.
     */
    public List<QueryOutcome> batchQuery(List<String> texts, String indexId, int topK) {
        List<Future<QueryOutcome>> pending = new ArrayList<>(texts.size());
        for (String text : texts) {
            pending.add(workers.submit(() -> {
                try {
                    return QueryOutcome.success(text, query(text, indexId, topK));
                } catch (SemanticSearchException e) {
                    return QueryOutcome.failure(text, e);
                }
            }));
        }

        List<QueryOutcome> outcomes = new ArrayList<>(pending.size());
        for (Future<QueryOutcome> future : pending) {
            try {
                outcomes.add(future.get());
            } catch (ExecutionException e) {
                throw unwrap(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.forEach(remaining -> remaining.cancel(true));
                throw new SemanticSearchException(ErrorKind.QUERY_TIMEOUT, "Batch query interrupted", e);
            }
        }
        long failures = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
        log.debug("batch index={} queries={} failures={}", indexId, outcomes.size(), failures);
        return outcomes;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void validate(String text, int topK) {
        if (text == null || text.isBlank()) {
            throw new SemanticSearchException(ErrorKind.EMPTY_QUERY, "Query text must not be blank");
        }
        if (topK < 1) {
            throw new SemanticSearchException(ErrorKind.INVALID_TOP_K, "top_k must be at least 1, got " + topK);
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        if (e.getCause() instanceof RuntimeException cause) {
            return cause;
        }
        return new IllegalStateException("Query failed", e.getCause());
    }
}
