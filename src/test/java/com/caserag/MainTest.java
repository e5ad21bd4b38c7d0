package com.caserag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.caserag.ingest.IngestionManifest;
import com.caserag.runtime.AppConfig;
import com.caserag.store.LocalJsonVectorStore;

import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    private Path configPath;
    private Path casesRoot;

    @BeforeEach
    void setUp() throws IOException {
        casesRoot = tempDir.resolve("cases");
        Files.createDirectories(casesRoot);
        configPath = tempDir.resolve("application.yml");
        Files.writeString(configPath, """
                storage:
                  casesRoot: %s
                  vectorStorePath: %s
                  manifestPath: %s
                embedding:
                  provider: hashing
                  dimensions: 32
                completion:
                  provider: extractive
                chunking:
                  chunkSize: 8
                  chunkOverlap: 2
                """.formatted(
                yamlPath(casesRoot),
                yamlPath(tempDir.resolve("vector_store")),
                yamlPath(tempDir.resolve("manifest.json"))));
    }

    private static String yamlPath(Path path) {
        return path.toString().replace('\\', '/');
    }

    private void writeValidCase(String caseId) throws IOException {
        Path dir = Files.createDirectories(casesRoot.resolve(caseId));
        Files.writeString(dir.resolve("metadata.json"), """
                {
                  "case_id": "%s",
                  "title": "State v. Doe",
                  "defendant": "John Doe",
                  "date": "2021-03-01",
                  "court": "District Court",
                  "evaluator": "Dr. Smith",
                  "question": "Competency to stand trial",
                  "summary": "Competent after restoration.",
                  "documents": [
                    {"filename": "report.txt", "type": "evaluation_report", "date": "2021-03-01", "description": "Initial"}
                  ],
                  "key_findings": ["Competent"]
                }
                """.formatted(caseId));
        Files.writeString(dir.resolve("report.txt"),
                "The defendant was found competent to stand trial after a period of restoration treatment.");
    }

    private int run(String... args) {
        Main main = new Main();
        main.environment = Map.of();
        return new CommandLine(main).execute(args);
    }

    @Test
    void shouldParseHelp() {
        assertEquals(0, run("--help"));
    }

    @Test
    void unknownModeIsAUsageError() {
        assertEquals(2, run("--mode", "benchmark", "--config", configPath.toString()));
    }

    @Test
    void validateModeFailsWhenAnyCaseIsInvalid() throws IOException {
        writeValidCase("case_001");
        assertEquals(0, run("--mode", "validate", "--config", configPath.toString()));

        Files.createDirectories(casesRoot.resolve("case_002"));
        assertEquals(1, run("--mode", "validate", "--config", configPath.toString()));
        assertEquals(0, run("--mode", "validate", "--case", "case_001", "--config", configPath.toString()));
    }

    @Test
    void ingestModeShouldIngestValidCasesIdempotently() throws IOException {
        writeValidCase("case_001");
        Files.createDirectories(casesRoot.resolve("broken"));

        assertEquals(0, run("--mode", "ingest", "--config", configPath.toString(), "--metadata", "source=test"));
        int stored = LocalJsonVectorStore.open(tempDir.resolve("vector_store"), "forensic_cases").count();
        assertTrue(stored > 0);

        assertEquals(0, run("--mode", "ingest", "--config", configPath.toString()));
        assertEquals(stored, LocalJsonVectorStore.open(tempDir.resolve("vector_store"), "forensic_cases").count());

        assertEquals(0, run("--mode", "ingest", "--force", "--config", configPath.toString()));
        assertEquals(2 * stored, LocalJsonVectorStore.open(tempDir.resolve("vector_store"), "forensic_cases").count());

        assertEquals(0, run("--mode", "ingest", "--clear", "--config", configPath.toString()));
        assertEquals(stored, LocalJsonVectorStore.open(tempDir.resolve("vector_store"), "forensic_cases").count());
    }

    @Test
    void ingestModeWithoutValidCasesFails() throws IOException {
        Files.createDirectories(casesRoot.resolve("case_001"));

        assertEquals(1, run("--mode", "ingest", "--config", configPath.toString()));
        assertEquals(1, run("--mode", "ingest", "--case", "case_404", "--config", configPath.toString()));
    }

    @Test
    void missingDataDirectoryFails() throws IOException {
        Files.delete(casesRoot);

        assertEquals(1, run("--mode", "ingest", "--config", configPath.toString()));
    }

    @Test
    void queryAndSearchModesRequireInput() throws IOException {
        writeValidCase("case_001");
        run("--mode", "ingest", "--config", configPath.toString());

        assertEquals(2, run("--mode", "query", "--config", configPath.toString()));
        assertEquals(2, run("--mode", "query", "--query", "   ", "--config", configPath.toString()));
        assertEquals(0, run("--mode", "query", "--query", "Was the defendant competent?", "--case", "case_001",
                "--config", configPath.toString()));

        assertEquals(2, run("--mode", "search-cases", "--config", configPath.toString()));
        assertEquals(2, run("--mode", "search-cases", "--description", "competency", "--top-n", "0",
                "--config", configPath.toString()));
        assertEquals(0, run("--mode", "search-cases", "--description", "competency restoration", "--top-n", "3",
                "--config", configPath.toString()));
    }

    @Test
    void maintenanceModesRunAgainstTheEngine() throws IOException {
        writeValidCase("case_001");
        run("--mode", "ingest", "--config", configPath.toString());

        assertEquals(0, run("--mode", "cases", "--config", configPath.toString()));
        assertEquals(0, run("--mode", "count", "--config", configPath.toString()));
        assertEquals(2, run("--mode", "clear-case", "--config", configPath.toString()));
        assertEquals(0, run("--mode", "clear-case", "--case", "case_001", "--config", configPath.toString()));

        IngestionManifest manifest = new IngestionManifest(tempDir.resolve("manifest.json"));
        manifest.load();
        assertEquals(0, manifest.size());

        run("--mode", "ingest", "--config", configPath.toString());
        assertEquals(0, run("--mode", "clear", "--config", configPath.toString()));
        assertEquals(0, LocalJsonVectorStore.open(tempDir.resolve("vector_store"), "forensic_cases").count());
        assertFalse(Files.exists(tempDir.resolve("manifest.json")));
    }

    @Test
    void missingConfigFileFallsBackToDefaults() throws IOException {
        AppConfig config = Main.loadConfig(tempDir.resolve("absent.yml"));

        assertEquals("./data/cases", config.getStorage().getCasesRoot());
    }
}
