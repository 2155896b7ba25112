package com.mcpfactory.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mcpfactory.orchestrator.model.JobRecord;
import com.mcpfactory.orchestrator.model.JobStatus;
import com.mcpfactory.orchestrator.model.PipelineStage;

import java.time.Instant;

/**
 * One row of GET /api/jobs. name is the generated server's name once the job
 * is complete.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSummary(
        String        jobId,
        JobStatus     status,
        PipelineStage stage,
        Instant       createdAt,
        String        name
) {
    public static JobSummary from(JobRecord job) {
        return new JobSummary(
                job.id(),
                job.status(),
                job.currentStage(),
                job.createdAt(),
                job.result() == null ? null : job.result().name()
        );
    }
}
