package com.mcpfactory.orchestrator.api;

import com.mcpfactory.orchestrator.TestSpecs;
import com.mcpfactory.orchestrator.model.FailureKind;
import com.mcpfactory.orchestrator.model.JobOptions;
import com.mcpfactory.orchestrator.model.JobRecord;
import com.mcpfactory.orchestrator.model.PipelineResult;
import com.mcpfactory.orchestrator.model.PipelineStage;
import com.mcpfactory.orchestrator.registry.RegistrationResult;
import com.mcpfactory.orchestrator.service.InvalidSubmissionException;
import com.mcpfactory.orchestrator.service.JobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.contains;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Slice test for JobController.
 *
 * Only the web layer starts; JobService is a mock, so no pipeline runs.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired MockMvc      mockMvc;
    @MockitoBean JobService jobService;

    // ------------------------------------------------------------------
    // POST /api/generate
    // ------------------------------------------------------------------

    @Test
    void generate_validRequest_returns202WithJobId() throws Exception {
        when(jobService.submit(eq("weather lookup tool"), isNull(), eq(true))).thenReturn("job_1_abcdef01");

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"description":"weather lookup tool","docker":true}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job_id").value("job_1_abcdef01"))
                .andExpect(jsonPath("$.status").value("queued"));
    }

    @Test
    void generate_missingDescription_returns400WithError() throws Exception {
        when(jobService.submit(any(), any(), any()))
                .thenThrow(new InvalidSubmissionException("Description is required"));

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Description is required"));
    }

    @Test
    void generate_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed JSON request body"));
    }

    @Test
    void generate_unexpectedFailure_returns500WithFixedMessage() throws Exception {
        when(jobService.submit(any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Record id 'x' does not match key 'y'"));

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"weather\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value(ApiExceptionHandler.INTERNAL_ERROR));
    }

    // ------------------------------------------------------------------
    // GET /api/jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void getJob_running_returnsStageAndNoOutcome() throws Exception {
        JobRecord job = queued().start().advance(PipelineStage.INTERPRET);
        when(jobService.find(job.id())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/api/jobs/{id}", job.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value(job.id()))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.stage").value("generate"))
                .andExpect(jsonPath("$.stages_completed", contains("interpret")))
                .andExpect(jsonPath("$.created_at").value("2026-03-01T10:00:00Z"))
                .andExpect(jsonPath("$.result").doesNotExist())
                .andExpect(jsonPath("$.errors").doesNotExist())
                .andExpect(jsonPath("$.failure_kind").doesNotExist());
    }

    @Test
    void getJob_complete_returnsResult() throws Exception {
        JobRecord job = queued().start()
                .advance(PipelineStage.INTERPRET)
                .advance(PipelineStage.GENERATE)
                .advance(PipelineStage.VALIDATE)
                .advance(PipelineStage.PACKAGE)
                .complete(new PipelineResult("weather", "Weather lookups", "/out/mcp-weather",
                        "/packages/mcp-weather-1.0.0.tgz", null, TestSpecs.weather(),
                        new RegistrationResult("3f0c", "weather", "1.0.0", RegistrationResult.Action.CREATED),
                        PipelineStage.PIPELINE, List.of("[lint] src/index.ts:3 - no-console")),
                        CREATED.plusSeconds(40));
        when(jobService.find(job.id())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/api/jobs/{id}", job.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("complete"))
                .andExpect(jsonPath("$.stage").value("done"))
                .andExpect(jsonPath("$.result.name").value("weather"))
                .andExpect(jsonPath("$.result.server_dir").value("/out/mcp-weather"))
                .andExpect(jsonPath("$.result.package_path").value("/packages/mcp-weather-1.0.0.tgz"))
                .andExpect(jsonPath("$.result.registration.action").value("created"))
                .andExpect(jsonPath("$.result.warnings[0]").value("[lint] src/index.ts:3 - no-console"))
                .andExpect(jsonPath("$.errors").doesNotExist());
    }

    @Test
    void getJob_failed_returnsErrorsAndKind() throws Exception {
        JobRecord job = queued().start()
                .advance(PipelineStage.INTERPRET)
                .advance(PipelineStage.GENERATE)
                .fail(FailureKind.COMPLIANCE, "Validation failed: [protocol] No tools declared",
                        CREATED.plusSeconds(5));
        when(jobService.find(job.id())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/api/jobs/{id}", job.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.stage").value("validate"))
                .andExpect(jsonPath("$.failure_kind").value("compliance"))
                .andExpect(jsonPath("$.errors[0]").value("Validation failed: [protocol] No tools declared"))
                .andExpect(jsonPath("$.result").doesNotExist());
    }

    @Test
    void getJob_unknownId_returns404() throws Exception {
        when(jobService.find("job_nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/jobs/{id}", "job_nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Job not found: job_nope"));
    }

    // ------------------------------------------------------------------
    // GET /api/jobs
    // ------------------------------------------------------------------

    @Test
    void listJobs_defaultLimit_returnsSummaries() throws Exception {
        when(jobService.recent(JobController.DEFAULT_LIMIT)).thenReturn(List.of(queued()));

        mockMvc.perform(get("/api/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.jobs[0].job_id").value("job_1_abcdef01"))
                .andExpect(jsonPath("$.jobs[0].status").value("queued"))
                .andExpect(jsonPath("$.jobs[0].stage").value("interpret"));
    }

    @Test
    void listJobs_limitIsClamped() throws Exception {
        when(jobService.recent(anyInt())).thenReturn(List.of());

        mockMvc.perform(get("/api/jobs").param("limit", "100000")).andExpect(status().isOk());
        mockMvc.perform(get("/api/jobs").param("limit", "-3")).andExpect(status().isOk());

        verify(jobService).recent(JobController.MAX_LIMIT);
        verify(jobService).recent(0);
    }

    @Test
    void listJobs_nonNumericLimit_returns400() throws Exception {
        mockMvc.perform(get("/api/jobs").param("limit", "lots"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid value for parameter 'limit'"));
    }

    @Test
    void getJob_wrongMethod_keeps405() throws Exception {
        mockMvc.perform(post("/api/jobs/{id}", "job_1_abcdef01"))
                .andExpect(status().isMethodNotAllowed());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static JobRecord queued() {
        return JobRecord.queued("job_1_abcdef01", "weather lookup tool", JobOptions.defaults(), CREATED);
    }
}
