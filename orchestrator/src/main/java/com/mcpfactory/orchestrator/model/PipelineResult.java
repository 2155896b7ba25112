package com.mcpfactory.orchestrator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mcpfactory.orchestrator.interpret.ServerSpec;
import com.mcpfactory.orchestrator.registry.RegistrationResult;

import java.util.List;

/**
 * Payload of a COMPLETE job.
 *
 * warnings holds every non-fatal validation finding that was tolerated on the
 * way through VALIDATE; it is empty for a clean run.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PipelineResult(
        String             name,
        String             description,
        String             serverDir,
        String             packagePath,
        String             dockerImage,
        ServerSpec         spec,
        RegistrationResult registration,
        List<PipelineStage> stagesCompleted,
        List<String>       warnings
) {
    public PipelineResult {
        stagesCompleted = stagesCompleted == null ? List.of() : List.copyOf(stagesCompleted);
        warnings        = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
