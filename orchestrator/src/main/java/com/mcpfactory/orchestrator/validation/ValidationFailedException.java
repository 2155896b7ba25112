package com.mcpfactory.orchestrator.validation;

/**
 * Raised by the validate stage when the report has errors. Carries the report
 * so the caller can decide whether the errors are fatal.
 */
public class ValidationFailedException extends RuntimeException {

    private final ValidationReport report;

    public ValidationFailedException(ValidationReport report) {
        super("Validation failed: " + report.errorSummary());
        this.report = report;
    }

    public ValidationReport report() {
        return report;
    }
}
