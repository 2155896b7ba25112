package com.mcpfactory.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mcpfactory.orchestrator.model.JobRecord;
import com.mcpfactory.orchestrator.model.JobStatus;
import com.mcpfactory.orchestrator.model.PipelineResult;
import com.mcpfactory.orchestrator.model.PipelineStage;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Response body for GET /api/jobs/{id}.
 *
 * result is present only for a complete job, errors and failure_kind only
 * for a failed one.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        String              jobId,
        JobStatus           status,
        PipelineStage       stage,
        String              description,
        String              runtime,
        boolean             docker,
        Instant             createdAt,
        Instant             completedAt,
        Instant             failedAt,
        List<PipelineStage> stagesCompleted,
        PipelineResult      result,
        List<String>        errors,
        String              failureKind
) {
    public static JobResponse from(JobRecord job) {
        return new JobResponse(
                job.id(),
                job.status(),
                job.currentStage(),
                job.description(),
                job.options().runtime(),
                job.options().docker(),
                job.createdAt(),
                job.completedAt(),
                job.failedAt(),
                job.stagesCompleted(),
                job.result(),
                job.errors().isEmpty() ? null : job.errors(),
                job.failureKind() == null ? null : job.failureKind().name().toLowerCase(Locale.ROOT)
        );
    }
}
