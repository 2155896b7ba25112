package com.mcpfactory.orchestrator.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One validation error or warning.
 *
 * @param file path relative to the server directory, or null
 * @param line 1-based line number, or null when not tied to a line
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(IssueCategory category, String file, Integer line, String message) {

    public static ValidationIssue of(IssueCategory category, String message) {
        return new ValidationIssue(category, null, null, message);
    }

    public static ValidationIssue at(IssueCategory category, String file, Integer line, String message) {
        return new ValidationIssue(category, file, line, message);
    }

    /** {@code [typescript] src/index.ts:42 - message} */
    public String format() {
        StringBuilder sb = new StringBuilder("[").append(category.wireName()).append("] ");
        if (file != null) {
            sb.append(file);
            if (line != null && line > 0) sb.append(':').append(line);
            sb.append(" - ");
        }
        return sb.append(message).toString();
    }
}
