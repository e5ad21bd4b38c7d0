package com.caserag.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class TextDocumentLoader extends ExtensionDocumentLoader {

    public TextDocumentLoader() {
        super(".txt");
    }

    @Override
    public List<SourceDocument> load(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return List.of(new SourceDocument(fileName, content, Map.of("file_name", fileName)));
    }
}
