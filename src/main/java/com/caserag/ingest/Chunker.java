package com.caserag.ingest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits document text into overlapping word windows.
 */
public class Chunker {
    private final int maxWords;
    private final int overlapWords;

    public Chunker(int maxWords, int overlapWords) {
        if (maxWords <= 0) {
            throw new IllegalArgumentException("maxWords must be positive");
        }
        if (overlapWords < 0 || overlapWords >= maxWords) {
            throw new IllegalArgumentException("overlapWords must be in [0, maxWords)");
        }
        this.maxWords = maxWords;
        this.overlapWords = overlapWords;
    }

    public List<DocumentFragment> chunk(SourceDocument document) {
        String stripped = document.text() == null ? "" : document.text().strip();
        if (stripped.isEmpty()) {
            return List.of();
        }
        String[] words = stripped.split("\\s+");
        List<DocumentFragment> fragments = new ArrayList<>();

        int start = 0;
        int chunkIndex = 0;
        while (start < words.length) {
            int endExclusive = Math.min(words.length, start + maxWords);
            String text = String.join(" ", Arrays.copyOfRange(words, start, endExclusive));
            Map<String, String> metadata = new HashMap<>(document.metadata());
            metadata.put("file_name", document.fileName());
            metadata.put("chunk_index", Integer.toString(chunkIndex));
            fragments.add(new DocumentFragment(document.fileName(), chunkIndex, text, metadata));
            if (endExclusive == words.length) {
                break;
            }
            start = endExclusive - overlapWords;
            chunkIndex++;
        }
        return fragments;
    }
}
