package com.semsearch.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemDocumentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldListTextAndMarkdownFilesSortedByName() throws Exception {
        Files.writeString(tempDir.resolve("b-notes.md"), "# Notes\nsecond");
        Files.writeString(tempDir.resolve("a-intro.txt"), "first");
        Files.writeString(tempDir.resolve("ignored.pdf"), "binary-ish");
        Files.createDirectories(tempDir.resolve("nested.txt"));

        List<Document> documents = new FileSystemDocumentStore(tempDir).listDocuments();

        assertEquals(List.of("a-intro.txt", "b-notes.md"), documents.stream().map(Document::id).toList());
        assertEquals("first", documents.get(0).text());
        assertEquals(5, documents.get(0).sizeBytes());
    }

    @Test
    void shouldReturnNothingForMissingDirectory() {
        assertTrue(new FileSystemDocumentStore(tempDir.resolve("missing")).listDocuments().isEmpty());
    }

    @Test
    void shouldSkipFilesThatAreNotUtf8() throws Exception {
        Files.write(tempDir.resolve("latin1.txt"), new byte[] { (byte) 0xC3, (byte) 0x28, 0x41 });
        Files.writeString(tempDir.resolve("ok.txt"), "fine");

        List<Document> documents = new FileSystemDocumentStore(tempDir).listDocuments();

        assertEquals(List.of("ok.txt"), documents.stream().map(Document::id).toList());
    }
}
