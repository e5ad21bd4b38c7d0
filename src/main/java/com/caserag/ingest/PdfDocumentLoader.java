package com.caserag.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * Extracts one document per PDF page so citations can point at a page label.
 */
public class PdfDocumentLoader extends ExtensionDocumentLoader {

    public PdfDocumentLoader() {
        super(".pdf");
    }

    @Override
    public List<SourceDocument> load(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        List<SourceDocument> pages = new ArrayList<>();
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(new SourceDocument(fileName, stripper.getText(document), Map.of(
                        "file_name", fileName,
                        "page_label", Integer.toString(page))));
            }
        }
        return pages;
    }
}
