package com.caserag.cases;

import java.util.List;

public record CaseValidationReport(String caseId, boolean valid, List<String> errors, List<String> warnings) {

    public CaseValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    static CaseValidationReport of(String caseId, List<String> errors, List<String> warnings) {
        return new CaseValidationReport(caseId, errors.isEmpty(), errors, warnings);
    }
}
