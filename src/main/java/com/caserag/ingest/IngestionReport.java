package com.caserag.ingest;

public record IngestionReport(String caseId, int contentFiles, int ingested, int skipped) {

    public static IngestionReport nothingToIngest(String caseId) {
        return new IngestionReport(caseId, 0, 0, 0);
    }

    public boolean isEmpty() {
        return contentFiles == 0;
    }
}
