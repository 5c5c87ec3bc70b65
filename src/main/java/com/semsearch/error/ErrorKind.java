package com.semsearch.error;

public enum ErrorKind {
    INVALID_CONFIGURATION(true),
    MODEL_UNAVAILABLE(true),
    EMPTY_INPUT(true),
    EMPTY_QUERY(true),
    INVALID_TOP_K(true),
    DIMENSION_MISMATCH(false),
    INDEX_NOT_FOUND(true),
    BACKEND_IO(false),
    QUERY_TIMEOUT(false);

    private final boolean userError;

    ErrorKind(boolean userError) {
        this.userError = userError;
    }

    /**
     * True when the failure was caused by caller input and can be reported verbatim.
     */
    public boolean isUserError() {
        return userError;
    }
}
