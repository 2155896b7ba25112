package com.mcpfactory.orchestrator.api.dto;

import com.mcpfactory.orchestrator.interpret.ServerSpec;

/**
 * Request body for POST /api/validate. Exactly one of the two is expected;
 * serverDir wins if both are given.
 *
 * @param serverDir path of a generated server on the orchestrator host
 * @param spec      a server spec to check structurally
 */
public record ValidateRequest(String serverDir, ServerSpec spec) {}
