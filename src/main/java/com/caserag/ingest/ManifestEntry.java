package com.caserag.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManifestEntry(
        @JsonProperty("case_id") String caseId,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("ingested_at") String ingestedAt,
        @JsonProperty("source_dir") String sourceDir) {
}
