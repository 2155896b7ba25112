package com.mcpfactory.orchestrator.api.dto;

/**
 * Request body for POST /api/generate.
 *
 * Required: description
 * Optional: runtime (defaults to "typescript"), docker (defaults to
 *   mcpfactory.packaging.docker)
 */
public record GenerateRequest(String description, String runtime, Boolean docker) {}
