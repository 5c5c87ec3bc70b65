package com.semsearch.ingest;

public record Document(String id, String text, long sizeBytes) {
}
