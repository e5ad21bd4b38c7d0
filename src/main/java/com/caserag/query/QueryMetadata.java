package com.caserag.query;

public record QueryMetadata(int totalChunksRetrieved, long processingTimeMs) {
}
