package com.mcpfactory.orchestrator.interpret;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A tool the generated server exposes. {@code name} is snake_case and doubles
 * as the TypeScript identifier prefix in the generated sources.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolSpec(
        String              name,
        String              description,
        List<ParameterSpec> parameters,
        String              returns
) {
    public ToolSpec {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
