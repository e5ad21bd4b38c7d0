package com.caserag.cases;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of a case's {@code metadata.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaseMetadata(
        @JsonProperty("case_id") String caseId,
        String title,
        String defendant,
        String date,
        String court,
        String evaluator,
        String question,
        String summary,
        List<DocumentMetadata> documents,
        @JsonProperty("key_findings") List<String> keyFindings) {

    public CaseMetadata {
        documents = documents == null ? List.of() : List.copyOf(documents);
        keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
    }
}
