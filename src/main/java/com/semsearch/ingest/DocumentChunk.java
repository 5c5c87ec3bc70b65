package com.semsearch.ingest;

public record DocumentChunk(String id, String text, ChunkMetadata metadata) {
}
