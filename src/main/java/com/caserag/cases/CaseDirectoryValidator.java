package com.caserag.cases;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.caserag.ingest.CaseDocumentReader;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Structural checks on a case directory before it is ingested. Errors make the case invalid; warnings
 * point at things that weaken case search but do not block ingestion.
 */
public class CaseDirectoryValidator {
    private static final Logger log = LoggerFactory.getLogger(CaseDirectoryValidator.class);

    static final String CASE_ID_PREFIX = "case_";
    static final List<String> REQUIRED_FIELDS = List.of(
            "case_id", "title", "defendant", "date", "court", "evaluator", "question");
    static final List<String> DOCUMENT_FIELDS = List.of("filename", "type", "date", "description");
    static final Set<String> STANDARD_DOCUMENT_TYPES = Set.of(
            "evaluation_report", "testimony", "correspondence", "risk_assessment", "civil_commitment");

    private final CaseDocumentReader documentReader;
    private final ObjectMapper mapper = new ObjectMapper();

    public CaseDirectoryValidator(CaseDocumentReader documentReader) {
        this.documentReader = documentReader;
    }

    public CaseValidationReport validate(Path caseDir, String caseId) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (!Files.exists(caseDir)) {
            errors.add("Case directory does not exist: " + caseDir);
            return CaseValidationReport.of(caseId, errors, warnings);
        }
        if (!Files.isDirectory(caseDir)) {
            errors.add("Case path is not a directory: " + caseDir);
            return CaseValidationReport.of(caseId, errors, warnings);
        }
        Path metadataFile = caseDir.resolve(CaseDocumentReader.METADATA_FILE);
        if (!Files.isRegularFile(metadataFile)) {
            errors.add("metadata.json file not found in case directory");
            return CaseValidationReport.of(caseId, errors, warnings);
        }

        JsonNode root;
        try {
            root = mapper.readTree(metadataFile.toFile());
        } catch (JsonProcessingException e) {
            errors.add("Invalid JSON: " + e.getOriginalMessage());
            return CaseValidationReport.of(caseId, errors, warnings);
        } catch (IOException e) {
            errors.add("Could not read metadata.json: " + e.getMessage());
            return CaseValidationReport.of(caseId, errors, warnings);
        }
        if (root == null || !root.isObject()) {
            errors.add("metadata.json must contain a JSON object");
            return CaseValidationReport.of(caseId, errors, warnings);
        }

        for (String field : REQUIRED_FIELDS) {
            requireString(root, field, field, errors);
        }
        JsonNode caseIdNode = root.get("case_id");
        if (caseIdNode != null && caseIdNode.isTextual()) {
            String declared = caseIdNode.asText();
            if (!declared.startsWith(CASE_ID_PREFIX)) {
                errors.add("case_id: must start with '" + CASE_ID_PREFIX + "'");
            } else if (!declared.equals(caseId)) {
                errors.add("case_id in metadata.json ('" + declared + "') does not match directory name ('" + caseId + "')");
            }
        }

        JsonNode summary = root.get("summary");
        if (summary != null && !summary.isNull() && !summary.isTextual()) {
            errors.add("summary: must be a string");
        } else if (summary == null || summary.isNull() || summary.asText().isBlank()) {
            warnings.add("No summary provided; case search will fall back to fragment text");
        }

        JsonNode findings = root.get("key_findings");
        if (findings != null && !findings.isNull()) {
            if (!findings.isArray()) {
                errors.add("key_findings: must be an array");
            } else if (findings.isEmpty()) {
                warnings.add("No key_findings provided");
            } else {
                for (int i = 0; i < findings.size(); i++) {
                    if (!findings.get(i).isTextual()) {
                        errors.add("key_findings." + i + ": must be a string");
                    }
                }
            }
        } else {
            warnings.add("No key_findings provided");
        }

        List<String> listedFiles = new ArrayList<>();
        JsonNode documents = root.get("documents");
        if (documents == null || documents.isNull()) {
            errors.add("documents: field required");
        } else if (!documents.isArray()) {
            errors.add("documents: must be an array");
        } else {
            for (int i = 0; i < documents.size(); i++) {
                JsonNode document = documents.get(i);
                String location = "documents." + i;
                if (!document.isObject()) {
                    errors.add(location + ": must be an object");
                    continue;
                }
                for (String field : DOCUMENT_FIELDS) {
                    requireString(document, field, location + "." + field, errors);
                }
                JsonNode type = document.get("type");
                if (type != null && type.isTextual() && !STANDARD_DOCUMENT_TYPES.contains(type.asText())) {
                    warnings.add("Document type '" + type.asText() + "' is not a standard type");
                }
                JsonNode filename = document.get("filename");
                if (filename != null && filename.isTextual()) {
                    listedFiles.add(filename.asText());
                }
            }
        }

        if (errors.isEmpty()) {
            checkFilesOnDisk(caseDir, listedFiles, warnings);
        }
        for (String warning : warnings) {
            log.warn("{}: {}", caseId, warning);
        }
        return CaseValidationReport.of(caseId, errors, warnings);
    }

    private void checkFilesOnDisk(Path caseDir, List<String> listedFiles, List<String> warnings) {
        for (String listed : listedFiles) {
            if (!Files.exists(caseDir.resolve(listed))) {
                warnings.add("Document file '" + listed + "' listed in metadata but not found in directory");
            }
        }
        Set<String> listed = new HashSet<>(listedFiles);
        List<String> unlisted = new ArrayList<>();
        try (Stream<Path> entries = Files.list(caseDir)) {
            entries.filter(Files::isRegularFile)
                    .filter(documentReader::isSupported)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !CaseDocumentReader.METADATA_FILE.equals(name) && !listed.contains(name))
                    .sorted()
                    .forEach(unlisted::add);
        } catch (IOException e) {
            warnings.add("Could not list case directory: " + e.getMessage());
            return;
        }
        if (!unlisted.isEmpty()) {
            warnings.add("Found documents in directory not listed in metadata.json: " + unlisted);
        }
    }

    private static void requireString(JsonNode node, String field, String location, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            errors.add(location + ": field required");
        } else if (!value.isTextual()) {
            errors.add(location + ": must be a string");
        }
    }
}
