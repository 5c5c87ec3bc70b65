package com.semsearch.index;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BuildReport(
        @JsonProperty("index_id") String indexId,
        @JsonProperty("documents_processed") int documentsProcessed,
        @JsonProperty("chunks_created") int chunksCreated,
        @JsonProperty("dimension") int dimension,
        @JsonProperty("elapsed_seconds") double elapsedSeconds) {
}
