package com.mcpfactory.orchestrator.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Verdict of one compliance check run. Findings are kept in extraction order.
 */
public record ComplianceReport(List<ComplianceIssue> findings) {

    public ComplianceReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    /** No fatal finding. Non-fatal findings do not affect the verdict. */
    @JsonProperty("compliant")
    public boolean compliant() {
        return findings.stream().noneMatch(ComplianceIssue::fatal);
    }

    /** Messages of all findings, fatal and non-fatal. */
    @JsonProperty("issues")
    public List<String> issues() {
        return findings.stream().map(ComplianceIssue::message).toList();
    }

    public List<ComplianceIssue> fatalIssues() {
        return findings.stream().filter(ComplianceIssue::fatal).toList();
    }

    public List<ComplianceIssue> warnings() {
        return findings.stream().filter(f -> !f.fatal()).toList();
    }
}
