package com.mcpfactory.orchestrator.service;

import com.mcpfactory.orchestrator.config.FactoryProperties;
import com.mcpfactory.orchestrator.validation.IssueCategory;
import com.mcpfactory.orchestrator.validation.ValidationIssue;
import com.mcpfactory.orchestrator.validation.ValidationReport;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether validation errors stop the pipeline.
 *
 * An error is fatal when its category is listed under
 * {@code mcpfactory.validation.fatal-categories}. Warnings are never fatal.
 */
@Component
public class FailureClassifier {

    private final Set<IssueCategory> fatalCategories;

    public FailureClassifier(FactoryProperties properties) {
        List<IssueCategory> configured = properties.getValidation().getFatalCategories();
        this.fatalCategories = configured.isEmpty()
                ? EnumSet.noneOf(IssueCategory.class)
                : EnumSet.copyOf(configured);
    }

    public boolean isFatal(ValidationIssue issue) {
        return fatalCategories.contains(issue.category());
    }

    /** True if at least one error of the report is in a fatal category. */
    public boolean isFatal(ValidationReport report) {
        return report.errors().stream().anyMatch(this::isFatal);
    }

    public List<ValidationIssue> fatalErrors(ValidationReport report) {
        return report.errors().stream().filter(this::isFatal).toList();
    }
}
