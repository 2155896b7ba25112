package com.mcpfactory.orchestrator.registry;

import com.mcpfactory.orchestrator.interpret.ServerSpec;

import java.util.Map;

/**
 * What the register stage hands to {@link ServerRegistry#registerOrUpdate}.
 * Only {@code name} is required; version defaults to 1.0.0.
 */
public record RegistrationRequest(
        String              name,
        String              version,
        String              description,
        ServerSpec          spec,
        String              packagePath,
        String              dockerImage,
        Map<String, Object> clientConfig
) {
    public RegistrationRequest {
        if (version == null || version.isBlank()) version = ServerSpec.DEFAULT_VERSION;
        if (description == null) description = "";
        clientConfig = clientConfig == null ? Map.of() : clientConfig;
    }
}
