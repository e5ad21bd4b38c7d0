package com.caserag.cases;

public record CaseSummary(String caseId, String title, String date, int documentCount) {
}
