package com.semsearch.index;

import com.semsearch.embedding.EmbeddingModel;
import com.semsearch.error.SemanticSearchException;

/**
 * Identifies an index by the model that produced its vectors and the backend storing them.
 * The textual form is {@code <backend>_<model short name>}, e.g. {@code exact_all-MiniLM-L6-v2}.
 */
public record IndexId(EmbeddingModel model, IndexBackend backend) {

    public String value() {
        return backend.id() + "_" + model.shortName();
    }

    /**
     * Parses the textual form. Identifiers that do not name a supported model and backend
     * cannot have been built, so they are reported as {@code INDEX_NOT_FOUND}.
     */
    public static IndexId parse(String value) {
        if (value == null || value.isBlank()) {
            throw SemanticSearchException.invalidConfiguration("Index id must not be blank");
        }
        String trimmed = value.strip();
        int separator = trimmed.indexOf('_');
        if (separator <= 0 || separator == trimmed.length() - 1) {
            throw SemanticSearchException.indexNotFound(trimmed);
        }
        try {
            IndexBackend backend = IndexBackend.fromId(trimmed.substring(0, separator));
            EmbeddingModel model = EmbeddingModel.fromId(trimmed.substring(separator + 1));
            return new IndexId(model, backend);
        } catch (SemanticSearchException e) {
            SemanticSearchException notFound = SemanticSearchException.indexNotFound(trimmed);
            notFound.initCause(e);
            throw notFound;
        }
    }

    @Override
    public String toString() {
        return value();
    }
}
