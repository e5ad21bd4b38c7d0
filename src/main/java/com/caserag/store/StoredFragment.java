package com.caserag.store;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredFragment(String id, long sequence, String text, Map<String, String> metadata, float[] embedding) {
    public static final String CASE_ID = "case_id";
    public static final String FILE_NAME = "file_name";

    public StoredFragment {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        text = text == null ? "" : text;
    }

    @JsonIgnore
    public String caseId() {
        return metadata.get(CASE_ID);
    }

    @JsonIgnore
    public String fileName() {
        return metadata.getOrDefault(FILE_NAME, "unknown");
    }
}
