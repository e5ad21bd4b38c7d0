package com.caserag.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface DocumentLoader {
    boolean supports(Path path);

    List<SourceDocument> load(Path path) throws IOException;
}
