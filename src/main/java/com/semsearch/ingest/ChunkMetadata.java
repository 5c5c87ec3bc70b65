package com.semsearch.ingest;

public record ChunkMetadata(
        String sourceDocument,
        int chunkIndex,
        int startOffset,
        int endOffset) {
}
