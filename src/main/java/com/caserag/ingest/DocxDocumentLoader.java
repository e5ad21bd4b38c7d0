package com.caserag.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

public class DocxDocumentLoader extends ExtensionDocumentLoader {

    public DocxDocumentLoader() {
        super(".docx");
    }

    @Override
    public List<SourceDocument> load(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        try (InputStream in = Files.newInputStream(path); XWPFDocument document = new XWPFDocument(in)) {
            String text = document.getParagraphs().stream()
                    .map(XWPFParagraph::getText)
                    .collect(Collectors.joining("\n"));
            return List.of(new SourceDocument(fileName, text, Map.of("file_name", fileName)));
        }
    }
}
