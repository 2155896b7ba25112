package com.mcpfactory.orchestrator.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Read view of a {@link RegisteredServer} with its JSON columns parsed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ServerEntry(
        String   id,
        String   name,
        String   version,
        String   description,
        JsonNode spec,
        String   packagePath,
        String   dockerImage,
        JsonNode claudeConfig,
        Instant  createdAt,
        Instant  updatedAt
) {}
