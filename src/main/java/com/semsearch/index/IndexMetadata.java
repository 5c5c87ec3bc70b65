package com.semsearch.index;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexMetadata(
        @JsonProperty("index_id") String indexId,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("backend_id") String backendId,
        @JsonProperty("dimension") int dimension,
        @JsonProperty("chunk_count") int chunkCount,
        @JsonProperty("document_count") int documentCount,
        @JsonProperty("created_at") Instant createdAt) {
}
