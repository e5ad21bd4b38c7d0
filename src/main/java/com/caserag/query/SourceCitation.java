package com.caserag.query;

public record SourceCitation(String fragmentId, String documentId, String snippet, double relevanceScore) {
}
