package com.semsearch.embedding;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-wide cache of loaded embedding models. Each model is loaded lazily on first use and
 * at most once, even when several callers ask for it at the same time.
 */
public class EmbeddingModelRegistry {
    private final Function<EmbeddingModel, EmbeddingService> loader;
    private final Map<EmbeddingModel, EmbeddingService> loaded = new ConcurrentHashMap<>();

    public EmbeddingModelRegistry() {
        this(LocalModelEmbeddingService::new);
    }

    public EmbeddingModelRegistry(Function<EmbeddingModel, EmbeddingService> loader) {
        this.loader = loader;
    }

    public EmbeddingService get(String modelId) {
        return get(EmbeddingModel.fromId(modelId));
    }

    public EmbeddingService get(EmbeddingModel model) {
        return loaded.computeIfAbsent(model, loader);
    }

    public boolean isLoaded(EmbeddingModel model) {
        return loaded.containsKey(model);
    }
}
