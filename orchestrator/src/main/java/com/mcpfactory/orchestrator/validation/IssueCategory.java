package com.mcpfactory.orchestrator.validation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where a validation issue came from. Which categories stop the pipeline is
 * configured under {@code mcpfactory.validation.fatal-categories}.
 */
public enum IssueCategory {
    FILESYSTEM,   // server directory missing
    TYPESCRIPT,   // tsc errors, missing tsconfig
    TOOLCHAIN,    // node_modules / tsc / eslint unavailable
    LINT,         // eslint findings
    PROTOCOL,     // compliance checker findings on src/index.ts
    DEPENDENCY;   // package.json problems

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
