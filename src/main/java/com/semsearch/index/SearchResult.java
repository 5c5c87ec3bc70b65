package com.semsearch.index;

import com.semsearch.ingest.DocumentChunk;

public record SearchResult(DocumentChunk chunk, float score) {
}
