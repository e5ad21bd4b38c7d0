package com.caserag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lists and loads the content files of one case directory. Only the top level is read, and only files
 * that one of the loaders accepts; the case descriptor is never treated as content.
 */
public class CaseDocumentReader {
    public static final String METADATA_FILE = "metadata.json";

    private final List<DocumentLoader> loaders;

    public CaseDocumentReader() {
        this(List.of(new TextDocumentLoader(), new PdfDocumentLoader(), new DocxDocumentLoader()));
    }

    public CaseDocumentReader(List<DocumentLoader> loaders) {
        this.loaders = List.copyOf(loaders);
    }

    public List<Path> listContentFiles(Path caseDirectory) throws IOException {
        try (Stream<Path> entries = Files.list(caseDirectory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> !METADATA_FILE.equals(path.getFileName().toString()))
                    .filter(this::isSupported)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }

    public boolean isSupported(Path path) {
        return loaders.stream().anyMatch(loader -> loader.supports(path));
    }

    public List<SourceDocument> load(Path path) throws IOException {
        for (DocumentLoader loader : loaders) {
            if (loader.supports(path)) {
                return loader.load(path);
            }
        }
        throw new IllegalArgumentException("Unsupported content file: " + path);
    }
}
