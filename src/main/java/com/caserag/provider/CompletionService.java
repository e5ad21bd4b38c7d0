package com.caserag.provider;

import java.util.List;

public interface CompletionService {
    /**
     * Generates an answer for {@code query} grounded on {@code contexts}, which are ordered by relevance.
     */
    String complete(String query, List<String> contexts);

    /**
     * Returns the leading run of {@code contexts} this provider will actually send for {@code query}.
     * Callers cite only these. The default keeps every context.
     */
    default List<String> fitContexts(String query, List<String> contexts) {
        return contexts;
    }
}
