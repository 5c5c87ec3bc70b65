package com.semsearch.ingest;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.error.SemanticSearchException;

/**
 * Documents are the {@code .txt} and {@code .md} files directly inside the data directory,
 * identified by file name.
 */
public class FileSystemDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentStore.class);
    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".txt", ".md");

    private final Path dataDir;

    public FileSystemDocumentStore(Path dataDir) {
        this.dataDir = dataDir;
    }

    @Override
    public List<Document> listDocuments() {
        if (!Files.isDirectory(dataDir)) {
            log.warn("Data directory {} does not exist; no documents available", dataDir);
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(dataDir)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(FileSystemDocumentStore::isSupported)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw SemanticSearchException.backendIo("Unable to list documents in " + dataDir, e);
        }

        List<Document> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                String text = Files.readString(file, StandardCharsets.UTF_8);
                documents.add(new Document(name, text, Files.size(file)));
            } catch (CharacterCodingException e) {
                log.warn("Skipping {}: not valid UTF-8 text", name);
            } catch (IOException e) {
                throw SemanticSearchException.backendIo("Unable to read document " + file, e);
            }
        }
        log.debug("Loaded {} documents from {}", documents.size(), dataDir);
        return documents;
    }

    private static boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
