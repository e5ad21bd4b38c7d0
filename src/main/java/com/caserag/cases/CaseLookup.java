package com.caserag.cases;

import java.util.Optional;

/**
 * Outcome of reading a case's metadata: either the parsed metadata, or the reason the caller has to
 * fall back to derived values.
 */
public record CaseLookup(String caseId, CaseMetadata metadata, FallbackReason fallbackReason, String detail) {

    public enum FallbackReason {
        NO_CASE_DIRECTORY,
        NO_METADATA_FILE,
        UNREADABLE_METADATA
    }

    public static CaseLookup found(String caseId, CaseMetadata metadata) {
        return new CaseLookup(caseId, metadata, null, "");
    }

    public static CaseLookup fallback(String caseId, FallbackReason reason, String detail) {
        return new CaseLookup(caseId, null, reason, detail == null ? "" : detail);
    }

    public boolean isFound() {
        return metadata != null;
    }

    public Optional<CaseMetadata> metadataIfFound() {
        return Optional.ofNullable(metadata);
    }
}
