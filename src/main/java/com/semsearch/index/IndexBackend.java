package com.semsearch.index;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.semsearch.error.SemanticSearchException;

public enum IndexBackend {
    EXACT("exact", false),
    LOCAL_JSON("local-json", true);

    private final String id;
    private final boolean persistent;

    IndexBackend(String id, boolean persistent) {
        this.id = id;
        this.persistent = persistent;
    }

    public String id() {
        return id;
    }

    /**
     * Whether indices of this backend survive the process and can be loaded later.
     */
    public boolean persistent() {
        return persistent;
    }

    public VectorIndex create(IndexId indexId) {
        return switch (this) {
            case EXACT -> new InMemoryVectorIndex(indexId);
            case LOCAL_JSON -> new LocalJsonVectorIndex(indexId);
        };
    }

    public static IndexBackend fromId(String backendId) {
        if (backendId != null) {
            String requested = backendId.strip().toLowerCase(Locale.ROOT);
            for (IndexBackend backend : values()) {
                if (backend.id.equals(requested)) {
                    return backend;
                }
            }
        }
        throw SemanticSearchException.invalidConfiguration(
                "Unsupported index backend: " + backendId + " (supported: " + supportedIds() + ")");
    }

    public static String supportedIds() {
        return Arrays.stream(values()).map(IndexBackend::id).collect(Collectors.joining(", "));
    }
}
