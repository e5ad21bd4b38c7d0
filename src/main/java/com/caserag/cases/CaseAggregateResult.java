package com.caserag.cases;

import java.util.List;

/**
 * One ranked case. {@code relevanceScore} is on a 0-100 scale with one decimal place.
 */
public record CaseAggregateResult(
        String caseId,
        String title,
        double relevanceScore,
        String summary,
        List<String> keyFindings,
        int documentCount) {

    public CaseAggregateResult {
        keyFindings = List.copyOf(keyFindings);
    }
}
