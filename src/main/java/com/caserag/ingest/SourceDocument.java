package com.caserag.ingest;

import java.util.Map;

/**
 * Text extracted from one content file, or from one page of it for paged formats.
 */
public record SourceDocument(String fileName, String text, Map<String, String> metadata) {
    public SourceDocument {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
