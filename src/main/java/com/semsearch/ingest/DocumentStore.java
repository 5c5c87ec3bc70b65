package com.semsearch.ingest;

import java.util.List;

/**
 * Read-only source of the documents an index is built from.
 */
public interface DocumentStore {
    List<Document> listDocuments();
}
