package com.semsearch.index;

import java.io.IOException;
import java.nio.file.NoSuchFileException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.semsearch.error.SemanticSearchException;

/**
 * Runs storage operations, retrying once on I/O errors that may be transient.
 */
final class BackendIo {
    private static final Logger log = LoggerFactory.getLogger(BackendIo.class);

    @FunctionalInterface
    interface IoAction<T> {
        T run() throws IOException;
    }

    private BackendIo() {
    }

    static <T> T withRetry(String description, IoAction<T> action) {
        try {
            return action.run();
        } catch (JsonProcessingException | NoSuchFileException e) {
            throw SemanticSearchException.backendIo(description + " failed: " + e.getMessage(), e);
        } catch (IOException first) {
            log.warn("{} failed ({}); retrying once", description, first.getMessage());
            try {
                return action.run();
            } catch (IOException second) {
                second.addSuppressed(first);
                throw SemanticSearchException.backendIo(description + " failed: " + second.getMessage(), second);
            }
        }
    }
}
