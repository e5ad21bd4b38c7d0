package com.caserag.query;

import java.util.List;

/**
 * {@code sources} lists exactly the fragments the answer was generated from, in relevance order.
 */
public record QueryResult(String answer, List<SourceCitation> sources, QueryMetadata metadata) {
    public QueryResult {
        sources = List.copyOf(sources);
    }
}
