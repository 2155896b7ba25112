package com.mcpfactory.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mcpfactory.orchestrator.model.JobStatus;

/**
 * Response body for POST /api/generate. The caller polls GET /api/jobs/{job_id}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GenerateResponse(String jobId, JobStatus status) {}
