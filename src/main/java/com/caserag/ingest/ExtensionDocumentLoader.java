package com.caserag.ingest;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

abstract class ExtensionDocumentLoader implements DocumentLoader {
    private final List<String> extensions;

    ExtensionDocumentLoader(String... extensions) {
        this.extensions = List.of(extensions);
    }

    @Override
    public boolean supports(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(fileName::endsWith);
    }
}
