package com.caserag.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface VectorStore {
    /**
     * Adds a fragment and returns its store-unique identifier. Duplicate content is accepted.
     */
    String insert(String text, Map<String, String> metadata, float[] embedding);

    /**
     * Returns up to {@code k} fragments ordered by ascending distance, ties in insertion order.
     */
    List<FragmentHit> query(float[] embedding, int k, Optional<MetadataFilter> filter);

    int count();

    void deleteAll();

    int deleteWhere(MetadataFilter filter);

    /**
     * Persists everything inserted since the last flush.
     */
    void flush();
}
