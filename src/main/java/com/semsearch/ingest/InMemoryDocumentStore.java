package com.semsearch.ingest;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryDocumentStore implements DocumentStore {
    private final List<Document> documents = new CopyOnWriteArrayList<>();

    public InMemoryDocumentStore add(String id, String text) {
        documents.removeIf(existing -> existing.id().equals(id));
        documents.add(new Document(id, text, text.getBytes(StandardCharsets.UTF_8).length));
        return this;
    }

    @Override
    public List<Document> listDocuments() {
        List<Document> snapshot = new ArrayList<>(documents);
        snapshot.sort(Comparator.comparing(Document::id));
        return snapshot;
    }
}
