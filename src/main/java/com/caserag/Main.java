package com.caserag;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.caserag.cases.CaseAggregateResult;
import com.caserag.cases.CaseDirectoryValidator;
import com.caserag.cases.CaseMetadataRepository;
import com.caserag.cases.CaseSummary;
import com.caserag.cases.CaseValidationReport;
import com.caserag.engine.CaseRagEngine;
import com.caserag.ingest.CaseDocumentReader;
import com.caserag.ingest.IngestionReport;
import com.caserag.provider.ProviderException;
import com.caserag.query.QueryResult;
import com.caserag.query.SourceCitation;
import com.caserag.runtime.AppConfig;
import com.caserag.runtime.InvalidRequestException;
import com.caserag.store.VectorStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "case-rag",
        mixinStandardHelpOptions = true,
        version = "case-rag 0.1.0",
        description = "Ingest, query and rank forensic case documents.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final String RULE = "=".repeat(70);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "ingest",
            converter = ModeConverter.class)
    Mode mode;

    @Option(names = "--case", description = "Restrict to one case id (e.g. case_003)")
    String caseId;

    @Option(names = "--force", description = "Re-ingest files already recorded in the manifest", defaultValue = "false")
    boolean force;

    @Option(names = "--clear", description = "Clear the vector store and manifest before ingesting", defaultValue = "false")
    boolean clear;

    @Option(names = "--query", description = "Question text for query mode")
    String query;

    @Option(names = "--description", description = "Case description for search-cases mode")
    String description;

    @Option(names = "--top-n", description = "Number of cases to return in search-cases mode", defaultValue = "5")
    int topN;

    @Option(names = "--metadata", description = "Extra fragment metadata as key=value (repeatable)")
    Map<String, String> metadata;

    Map<String, String> environment = System.getenv();

    enum Mode {
        ingest("ingest"),
        validate("validate"),
        query("query"),
        searchCases("search-cases"),
        cases("cases"),
        count("count"),
        clear("clear"),
        clearCase("clear-case");

        private final String label;

        Mode(String label) {
            this.label = label;
        }

        static Mode fromLabel(String value) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Mode mode : values()) {
                if (mode.label.equals(normalized)) {
                    return mode;
                }
            }
            throw new IllegalArgumentException("Unknown mode: " + value);
        }

        @Override
        public String toString() {
            return label;
        }
    }

    static class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            try {
                return Mode.fromLabel(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath)).applyEnvironment(environment);
        log.info("Starting case-rag in {} mode", mode);
        log.info("Using config file: {}", configPath);
        log.info("Data directory: {}", config.getStorage().getCasesRoot());

        try {
            switch (mode) {
                case validate:
                    return runValidate(config);
                case ingest:
                    return runIngest(config);
                default:
                    try (CaseRagEngine engine = new CaseRagEngine(config)) {
                        engine.initialize();
                        return runWithEngine(engine);
                    }
            }
        } catch (InvalidRequestException e) {
            log.error("Invalid request: {}", e.getMessage());
            return 2;
        } catch (ProviderException | VectorStoreException e) {
            log.error("Request failed: {}", e.getMessage());
            return 1;
        }
    }

    private int runWithEngine(CaseRagEngine engine) throws IOException {
        switch (mode) {
            case query:
                return runQuery(engine);
            case searchCases:
                return runSearchCases(engine);
            case cases:
                List<CaseSummary> cases = engine.listCases();
                for (CaseSummary summary : cases) {
                    log.info("Case {} title=\"{}\" date={} documents={}",
                            summary.caseId(), summary.title(), summary.date(), summary.documentCount());
                }
                log.info("{} case(s) found", cases.size());
                return 0;
            case count:
                log.info("Total chunks in vector store: {}", engine.documentCount());
                return 0;
            case clear:
                log.warn("This will delete all documents from the vector store!");
                if (!engine.clearAll()) {
                    log.error("Failed to clear vector store");
                    return 1;
                }
                log.info("Vector store cleared successfully");
                return 0;
            case clearCase:
                if (caseId == null || caseId.isBlank()) {
                    log.error("--case is required in clear-case mode");
                    return 2;
                }
                int removed = engine.clearCase(caseId);
                log.info("Cleared case {}: {} manifest entries removed", caseId, removed);
                return 0;
            default:
                throw new IllegalStateException("Unhandled mode: " + mode);
        }
    }

    private int runQuery(CaseRagEngine engine) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in query mode");
            return 2;
        }
        QueryResult result = engine.query(query, caseId);
        log.info("Answer: {}", result.answer());
        List<SourceCitation> sources = result.sources();
        for (int i = 0; i < sources.size(); i++) {
            SourceCitation source = sources.get(i);
            log.info("Source #{} document={} relevance={} snippet={}",
                    i + 1,
                    source.documentId(),
                    String.format(Locale.ROOT, "%.4f", source.relevanceScore()),
                    source.snippet());
        }
        log.info("Retrieved {} chunks in {} ms", result.metadata().totalChunksRetrieved(),
                result.metadata().processingTimeMs());
        return 0;
    }

    private int runSearchCases(CaseRagEngine engine) {
        if (description == null || description.isBlank()) {
            log.error("--description is required in search-cases mode");
            return 2;
        }
        List<CaseAggregateResult> results = engine.rankCases(description, topN);
        if (results.isEmpty()) {
            log.info("No matching cases. Ingestion may be required.");
        }
        for (int i = 0; i < results.size(); i++) {
            CaseAggregateResult result = results.get(i);
            log.info("Case #{} {} \"{}\" relevance={} documents={}",
                    i + 1, result.caseId(), result.title(), result.relevanceScore(), result.documentCount());
            log.info("  summary: {}", result.summary());
            for (String finding : result.keyFindings()) {
                log.info("  - {}", finding);
            }
        }
        return 0;
    }

    private int runValidate(AppConfig config) throws IOException {
        List<Path> caseDirs = discoverCaseDirectories(config);
        if (caseDirs == null) {
            return 1;
        }
        List<Path> valid = validateCases(caseDirs);
        log.info("{} of {} cases are valid", valid.size(), caseDirs.size());
        return valid.size() == caseDirs.size() ? 0 : 1;
    }

    private int runIngest(AppConfig config) throws IOException {
        List<Path> caseDirs = discoverCaseDirectories(config);
        if (caseDirs == null) {
            return 1;
        }
        if (caseDirs.isEmpty()) {
            log.warn("No case directories found");
            return 0;
        }
        log.info("Found {} case directory(s)", caseDirs.size());

        banner("VALIDATING CASES");
        List<Path> validCases = validateCases(caseDirs);
        if (validCases.isEmpty()) {
            log.error("No valid cases found. Please fix validation errors.");
            return 1;
        }
        log.info("{} of {} cases are valid", validCases.size(), caseDirs.size());

        banner("INITIALIZING ENGINE");
        try (CaseRagEngine engine = new CaseRagEngine(config)) {
            engine.initialize();

            if (clear) {
                banner("CLEARING VECTOR STORE");
                log.warn("This will delete all documents from the vector store!");
                if (!engine.clearAll()) {
                    log.error("Failed to clear vector store");
                    return 1;
                }
                log.info("Vector store cleared successfully");
            }

            banner("INGESTING DOCUMENTS");
            if (force) {
                log.info("Force re-ingestion enabled (will re-ingest all documents)");
            }
            return ingestCases(engine, validCases);
        }
    }

    private int ingestCases(CaseRagEngine engine, List<Path> caseDirs) {
        int totalIngested = 0;
        int totalSkipped = 0;
        int successful = 0;
        int failed = 0;
        int empty = 0;

        for (Path caseDir : caseDirs) {
            String id = caseDir.getFileName().toString();
            log.info("Processing case: {}", id);
            try {
                IngestionReport report = engine.ingestCase(id, metadata, force, false);
                if (report.isEmpty()) {
                    log.warn("  No documents found in {}, nothing to ingest", id);
                    empty++;
                    continue;
                }
                log.info("  Found {} documents", report.contentFiles());
                if (report.ingested() > 0) {
                    log.info("  Ingested {} chunks", report.ingested());
                }
                if (report.skipped() > 0) {
                    log.info("  Skipped {} chunks (already ingested)", report.skipped());
                }
                totalIngested += report.ingested();
                totalSkipped += report.skipped();
                successful++;
            } catch (IOException | RuntimeException e) {
                log.error("  Error ingesting documents from {}: {}", id, e.getMessage());
                failed++;
            }
        }

        log.info(RULE);
        log.info("INGESTION COMPLETE");
        log.info("-".repeat(70));
        log.info("Cases processed:        {}", successful + failed);
        log.info("  Successful:           {}", successful);
        log.info("  Failed:               {}", failed);
        log.info("  Nothing to ingest:    {}", empty);
        log.info("Chunks ingested:        {}", totalIngested);
        log.info("Chunks skipped:         {}", totalSkipped);
        log.info("Total chunks in vector store: {}", engine.documentCount());
        log.info(RULE);
        return failed == 0 ? 0 : 1;
    }

    /**
     * Returns the case directories to process, or {@code null} after logging when the data directory or
     * the requested case is missing.
     */
    private List<Path> discoverCaseDirectories(AppConfig config) throws IOException {
        Path casesRoot = Path.of(config.getStorage().getCasesRoot());
        if (!Files.isDirectory(casesRoot)) {
            log.error("Data directory not found: {}", casesRoot);
            return null;
        }
        CaseMetadataRepository repository = new CaseMetadataRepository(casesRoot);
        if (caseId != null && !caseId.isBlank()) {
            Path caseDir = repository.caseDirectory(caseId);
            if (!Files.isDirectory(caseDir)) {
                log.error("Case directory not found: {}", caseDir);
                return null;
            }
            return List.of(caseDir);
        }
        List<Path> caseDirs = new ArrayList<>();
        for (String id : repository.caseIds()) {
            caseDirs.add(repository.caseDirectory(id));
        }
        return caseDirs;
    }

    private List<Path> validateCases(List<Path> caseDirs) {
        CaseDirectoryValidator validator = new CaseDirectoryValidator(new CaseDocumentReader());
        List<Path> valid = new ArrayList<>();
        for (Path caseDir : caseDirs) {
            String id = caseDir.getFileName().toString();
            log.info("Validating case: {}", id);
            CaseValidationReport report = validator.validate(caseDir, id);
            if (report.valid()) {
                log.info("  Valid case structure");
                valid.add(caseDir);
            } else {
                log.error("  Validation failed:");
                for (String error : report.errors()) {
                    log.error("    - {}", error);
                }
            }
        }
        return valid;
    }

    private static void banner(String title) {
        log.info(RULE);
        log.info(title);
        log.info(RULE);
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }
}
