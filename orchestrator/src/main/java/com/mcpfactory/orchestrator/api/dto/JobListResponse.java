package com.mcpfactory.orchestrator.api.dto;

import java.util.List;

public record JobListResponse(List<JobSummary> jobs, int count) {}
