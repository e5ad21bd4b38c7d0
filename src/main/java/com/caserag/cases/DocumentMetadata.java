package com.caserag.cases;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentMetadata(String filename, String type, String date, String description) {
}
