package com.mcpfactory.orchestrator.api.dto;

import java.util.List;

/**
 * Result of checking a spec with POST /api/validate.
 */
public record SpecCheckResponse(boolean valid, List<String> errors, List<String> warnings) {

    public static SpecCheckResponse of(List<String> errors) {
        return new SpecCheckResponse(errors.isEmpty(), errors, List.of());
    }
}
