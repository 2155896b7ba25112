package com.mcpfactory.orchestrator.api;

import com.mcpfactory.orchestrator.api.dto.GenerateRequest;
import com.mcpfactory.orchestrator.api.dto.GenerateResponse;
import com.mcpfactory.orchestrator.api.dto.JobListResponse;
import com.mcpfactory.orchestrator.api.dto.JobResponse;
import com.mcpfactory.orchestrator.api.dto.JobSummary;
import com.mcpfactory.orchestrator.model.JobStatus;
import com.mcpfactory.orchestrator.service.JobService;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for generation jobs.
 *
 * POST /api/generate       submit a description, returns a job id
 * GET  /api/jobs/{id}      poll one job
 * GET  /api/jobs?limit=N   most recent jobs, newest first
 */
@RestController
@Profile("!standalone")
@RequestMapping("/api")
public class JobController {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT     = 500;

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Submit a generation job. The pipeline runs in the background.
     *
     * Example:
     *   curl -X POST http://localhost:3456/api/generate \
     *     -H "Content-Type: application/json" \
     *     -d '{"description":"weather lookup tool"}'
     */
    @PostMapping("/generate")
    public ResponseEntity<GenerateResponse> generate(@RequestBody GenerateRequest req) {
        String jobId = jobService.submit(req.description(), req.runtime(), req.docker());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new GenerateResponse(jobId, JobStatus.QUEUED));
    }

    /** Returns 404 if the job id is unknown or has been swept. */
    @GetMapping("/jobs/{id}")
    public JobResponse getJob(@PathVariable String id) {
        return jobService.find(id)
                .map(JobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    @GetMapping("/jobs")
    public JobListResponse listJobs(@RequestParam(defaultValue = "" + DEFAULT_LIMIT) int limit) {
        int bounded = Math.max(0, Math.min(limit, MAX_LIMIT));
        List<JobSummary> jobs = jobService.recent(bounded).stream()
                .map(JobSummary::from)
                .toList();
        return new JobListResponse(jobs, jobs.size());
    }
}
