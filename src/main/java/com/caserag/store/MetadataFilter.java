package com.caserag.store;

import java.util.Map;
import java.util.Objects;

/**
 * Exact-match predicate on a single metadata key.
 */
public record MetadataFilter(String key, String value) {
    public MetadataFilter {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static MetadataFilter caseId(String caseId) {
        return new MetadataFilter(StoredFragment.CASE_ID, caseId);
    }

    public boolean matches(Map<String, String> metadata) {
        return metadata != null && value.equals(metadata.get(key));
    }
}
