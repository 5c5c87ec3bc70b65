package com.semsearch.error;

public class SemanticSearchException extends RuntimeException {
    private final ErrorKind kind;

    public SemanticSearchException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SemanticSearchException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static SemanticSearchException invalidConfiguration(String message) {
        return new SemanticSearchException(ErrorKind.INVALID_CONFIGURATION, message);
    }

    public static SemanticSearchException modelUnavailable(String modelId) {
        return new SemanticSearchException(ErrorKind.MODEL_UNAVAILABLE, "Unsupported embedding model: " + modelId);
    }

    public static SemanticSearchException dimensionMismatch(int expected, int actual) {
        return new SemanticSearchException(ErrorKind.DIMENSION_MISMATCH,
                "Vector dimension mismatch: expected " + expected + " but got " + actual);
    }

    public static SemanticSearchException indexNotFound(String indexId) {
        return new SemanticSearchException(ErrorKind.INDEX_NOT_FOUND,
                "Index '" + indexId + "' has not been built. Build it first (e.g. --mode build).");
    }

    public static SemanticSearchException backendIo(String message, Throwable cause) {
        return new SemanticSearchException(ErrorKind.BACKEND_IO,
                message + ". Rebuilding the index may resolve this.", cause);
    }
}
