package com.semsearch.embedding;

import java.util.Arrays;
import java.util.stream.Collectors;

import com.semsearch.error.SemanticSearchException;

/**
 * Supported embedding models. Each variant has a fixed output dimension and its own feature
 * weights, so vectors from different variants are never comparable.
 */
public enum EmbeddingModel {
    ALL_MINILM_L6_V2("sentence-transformers/all-MiniLM-L6-v2", 384, 0.35f, 0f),
    ALL_MPNET_BASE_V2("sentence-transformers/all-mpnet-base-v2", 768, 0.35f, 0.5f),
    PARAPHRASE_MINILM_L3_V2("sentence-transformers/paraphrase-MiniLM-L3-v2", 384, 0f, 0f);

    public static final EmbeddingModel DEFAULT = ALL_MINILM_L6_V2;

    private final String id;
    private final int dimension;
    private final float trigramWeight;
    private final float bigramWeight;

    EmbeddingModel(String id, int dimension, float trigramWeight, float bigramWeight) {
        this.id = id;
        this.dimension = dimension;
        this.trigramWeight = trigramWeight;
        this.bigramWeight = bigramWeight;
    }

    public String id() {
        return id;
    }

    /**
     * The id without its organisation prefix, e.g. {@code all-MiniLM-L6-v2}.
     */
    public String shortName() {
        return id.substring(id.lastIndexOf('/') + 1);
    }

    public int dimension() {
        return dimension;
    }

    float trigramWeight() {
        return trigramWeight;
    }

    float bigramWeight() {
        return bigramWeight;
    }

    /**
     * Resolves a model from its full id or short name.
     *
     * @throws SemanticSearchException with kind {@code MODEL_UNAVAILABLE} for anything else
     */
    public static EmbeddingModel fromId(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            throw SemanticSearchException.modelUnavailable(String.valueOf(modelId));
        }
        String requested = modelId.strip();
        for (EmbeddingModel model : values()) {
            if (model.id.equalsIgnoreCase(requested) || model.shortName().equalsIgnoreCase(requested)) {
                return model;
            }
        }
        throw SemanticSearchException.modelUnavailable(requested + " (supported: " + supportedIds() + ")");
    }

    public static String supportedIds() {
        return Arrays.stream(values()).map(EmbeddingModel::id).collect(Collectors.joining(", "));
    }
}
