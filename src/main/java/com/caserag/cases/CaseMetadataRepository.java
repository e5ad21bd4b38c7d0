package com.caserag.cases;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.caserag.ingest.CaseDocumentReader;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Read-only access to the case storage layout: one directory per case, named by case id, holding a
 * {@code metadata.json} descriptor next to the content files.
 */
public class CaseMetadataRepository {
    private static final Logger log = LoggerFactory.getLogger(CaseMetadataRepository.class);
    private static final String METADATA_FILE = CaseDocumentReader.METADATA_FILE;
    static final String UNKNOWN_DATE = "Unknown";

    private final Path casesRoot;
    private final ObjectMapper mapper = new ObjectMapper();

    public CaseMetadataRepository(Path casesRoot) {
        this.casesRoot = casesRoot;
    }

    public Path casesRoot() {
        return casesRoot;
    }

    public Path caseDirectory(String caseId) {
        return casesRoot.resolve(caseId);
    }

    public CaseLookup lookup(String caseId) {
        Path caseDir = caseDirectory(caseId);
        if (!Files.isDirectory(caseDir)) {
            return CaseLookup.fallback(caseId, CaseLookup.FallbackReason.NO_CASE_DIRECTORY, caseDir.toString());
        }
        Path metadataFile = caseDir.resolve(METADATA_FILE);
        if (!Files.isRegularFile(metadataFile)) {
            return CaseLookup.fallback(caseId, CaseLookup.FallbackReason.NO_METADATA_FILE, metadataFile.toString());
        }
        try {
            CaseMetadata metadata = mapper.readValue(metadataFile.toFile(), CaseMetadata.class);
            if (metadata == null) {
                return CaseLookup.fallback(caseId, CaseLookup.FallbackReason.UNREADABLE_METADATA, "empty document");
            }
            return CaseLookup.found(caseId, metadata);
        } catch (IOException e) {
            log.warn("Error loading metadata for {}: {}", caseId, e.getMessage());
            return CaseLookup.fallback(caseId, CaseLookup.FallbackReason.UNREADABLE_METADATA, e.getMessage());
        }
    }

    /**
     * Counts files with an extension in the case directory, excluding the metadata descriptor. This is an
     * approximation of the document count: any stray file with an extension is counted too. Returns 0
     * when the directory cannot be listed.
     */
    public int countContentFiles(String caseId) {
        Path caseDir = caseDirectory(caseId);
        if (!Files.isDirectory(caseDir)) {
            return 0;
        }
        try (Stream<Path> entries = Files.list(caseDir)) {
            return (int) entries
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.contains(".") && !METADATA_FILE.equals(name))
                    .count();
        } catch (IOException e) {
            log.debug("Could not list {}: {}", caseDir, e.getMessage());
            return 0;
        }
    }

    public List<String> caseIds() throws IOException {
        if (!Files.isDirectory(casesRoot)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(casesRoot)) {
            return entries
                    .filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .toList();
        }
    }

    public List<CaseSummary> listCases() throws IOException {
        List<CaseSummary> cases = new ArrayList<>();
        for (String directoryName : caseIds()) {
            CaseLookup lookup = lookup(directoryName);
            if (lookup.isFound()) {
                CaseMetadata metadata = lookup.metadata();
                cases.add(new CaseSummary(
                        orDefault(metadata.caseId(), directoryName),
                        orDefault(metadata.title(), directoryName),
                        orDefault(metadata.date(), UNKNOWN_DATE),
                        metadata.documents().size()));
            } else {
                cases.add(new CaseSummary(directoryName, directoryName, UNKNOWN_DATE, countContentFiles(directoryName)));
            }
        }
        return cases;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
