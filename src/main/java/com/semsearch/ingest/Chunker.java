package com.semsearch.ingest;

import java.util.ArrayList;
import java.util.List;

import com.semsearch.error.SemanticSearchException;

/**
 * Splits document text into overlapping character windows.
 *
 * <p>Consecutive chunks never leave a gap: each chunk starts strictly after the previous one
 * and no later than where it ended, and the last chunk ends at the end of the text. Window ends
 * prefer paragraph, line, sentence and word boundaries before falling back to a hard cut, which
 * never separates the two halves of a surrogate pair (except with a chunk size of 1).
 */
public class Chunker {
    public static final int DEFAULT_CHUNK_SIZE = 500;
    public static final int DEFAULT_OVERLAP = 50;

    private static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", "! ", "? ", " ");

    private final int chunkSize;
    private final int overlap;

    public Chunker() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    public Chunker(int chunkSize, int overlap) {
        if (chunkSize < 1) {
            throw SemanticSearchException.invalidConfiguration("chunk size must be at least 1, got " + chunkSize);
        }
        if (overlap < 0) {
            throw SemanticSearchException.invalidConfiguration("overlap must not be negative, got " + overlap);
        }
        if (overlap >= chunkSize) {
            throw SemanticSearchException.invalidConfiguration(
                    "overlap (" + overlap + ") must be smaller than chunk size (" + chunkSize + ")");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<DocumentChunk> chunk(Document document) {
        String text = document.text();
        List<DocumentChunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }

        int start = 0;
        int chunkIndex = 0;
        while (start < text.length()) {
            int limit = Math.min(text.length(), start + chunkSize);
            int end = limit == text.length() ? limit : breakPoint(text, start, limit);
            if (end - 1 > start && splitsSurrogatePair(text, end)) {
                end--;
            }
            ChunkMetadata metadata = new ChunkMetadata(document.id(), chunkIndex, start, end);
            String id = document.id() + "#" + chunkIndex;
            chunks.add(new DocumentChunk(id, text.substring(start, end), metadata));
            if (end == text.length()) {
                break;
            }
            int next = Math.max(end - overlap, start + 1);
            if (splitsSurrogatePair(text, next)) {
                next = next - 1 > start ? next - 1 : Math.min(next + 1, end);
            }
            start = alignToWordStart(text, next, end);
            chunkIndex++;
        }
        return chunks;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int overlap() {
        return overlap;
    }

    private int breakPoint(String text, int start, int limit) {
        // a break must leave the window long enough to move past the overlap
        int minEnd = start + Math.max(overlap + 1, chunkSize / 2);
        for (String separator : SEPARATORS) {
            int position = text.lastIndexOf(separator, limit - separator.length());
            if (position < start) {
                continue;
            }
            int candidate = position + separator.length();
            if (candidate >= minEnd && candidate <= limit) {
                return candidate;
            }
        }
        return limit;
    }

    private static boolean splitsSurrogatePair(String text, int position) {
        return position > 0 && position < text.length()
                && Character.isHighSurrogate(text.charAt(position - 1))
                && Character.isLowSurrogate(text.charAt(position));
    }

    private static int alignToWordStart(String text, int position, int end) {
        if (position == 0 || Character.isWhitespace(text.charAt(position - 1))) {
            return position;
        }
        for (int i = position; i < end; i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i + 1;
            }
        }
        return position;
    }
}
