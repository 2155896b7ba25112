package com.mcpfactory.orchestrator.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of validating a generated server. {@code valid} is true iff there
 * are no errors; warnings never affect it.
 */
public record ValidationReport(boolean valid, List<ValidationIssue> errors, List<ValidationIssue> warnings) {

    public ValidationReport {
        errors   = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("A report with errors cannot be valid");
        }
    }

    public static ValidationReport of(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        return new ValidationReport(errors == null || errors.isEmpty(), errors, warnings);
    }

    /** Errors joined with "; ", for logs and job error messages. */
    public String errorSummary() {
        return errors.stream().map(ValidationIssue::format).collect(Collectors.joining("; "));
    }
}
