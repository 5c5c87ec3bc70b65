package com.semsearch.query;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RankedResult(
        @JsonProperty("rank") int rank,
        @JsonProperty("content") String content,
        @JsonProperty("source_document") String sourceDocument,
        @JsonProperty("chunk_index") int chunkIndex,
        @JsonProperty("similarity_score") float similarityScore) {
}
