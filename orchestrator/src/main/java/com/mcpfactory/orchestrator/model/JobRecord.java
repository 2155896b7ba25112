package com.mcpfactory.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one pipeline run.
 *
 * Every state change produces a new JobRecord via one of the transition
 * methods below; the JobStore replaces the stored snapshot atomically, so a
 * status reader never observes a half-applied transition.
 *
 * Invariants (checked in the compact constructor):
 * <ul>
 *   <li>stagesCompleted is a prefix of {@link PipelineStage#PIPELINE}</li>
 *   <li>while QUEUED/RUNNING, currentStage is the first stage not yet completed</li>
 *   <li>COMPLETE ⇔ currentStage = DONE, result present, completedAt set</li>
 *   <li>FAILED ⇔ errors non-empty, failureKind present, failedAt set</li>
 *   <li>result and errors are never both present; completedAt and failedAt
 *       are never both set</li>
 * </ul>
 */
public record JobRecord(
        String              id,
        JobStatus           status,
        PipelineStage       currentStage,
        String              description,
        JobOptions          options,
        Instant             createdAt,
        Instant             completedAt,
        Instant             failedAt,
        List<PipelineStage> stagesCompleted,
        PipelineResult      result,
        List<String>        errors,
        FailureKind         failureKind
) {

    public JobRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(currentStage, "currentStage");
        Objects.requireNonNull(createdAt, "createdAt");
        options         = options == null ? JobOptions.defaults() : options;
        stagesCompleted = stagesCompleted == null ? List.of() : List.copyOf(stagesCompleted);
        errors          = errors == null ? List.of() : List.copyOf(errors);

        checkInvariants(status, currentStage, completedAt, failedAt,
                stagesCompleted, result, errors, failureKind);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** A freshly submitted job: nothing has run yet. */
    public static JobRecord queued(String id, String description, JobOptions options, Instant createdAt) {
        return new JobRecord(id, JobStatus.QUEUED, PipelineStage.INTERPRET, description, options,
                createdAt, null, null, List.of(), null, List.of(), null);
    }

    /** QUEUED → RUNNING. currentStage stays on the first stage. */
    public JobRecord start() {
        requireStatus(JobStatus.QUEUED);
        return new JobRecord(id, JobStatus.RUNNING, currentStage, description, options,
                createdAt, null, null, stagesCompleted, null, List.of(), null);
    }

    /**
     * Record that {@code finished} completed and move to the next stage.
     * The last stage must go through {@link #complete} instead, because
     * reaching DONE requires a result.
     */
    public JobRecord advance(PipelineStage finished) {
        requireStatus(JobStatus.RUNNING);
        requireCurrent(finished);
        if (finished.isLast()) {
            throw new IllegalStateException("Job " + id + ": last stage must complete with a result");
        }
        return new JobRecord(id, JobStatus.RUNNING, finished.next(), description, options,
                createdAt, null, null, append(finished), null, List.of(), null);
    }

    /** REGISTER finished: RUNNING → COMPLETE, currentStage → DONE. */
    public JobRecord complete(PipelineResult result, Instant at) {
        requireStatus(JobStatus.RUNNING);
        requireCurrent(PipelineStage.REGISTER);
        return new JobRecord(id, JobStatus.COMPLETE, PipelineStage.DONE, description, options,
                createdAt, at, null, append(PipelineStage.REGISTER), result, List.of(), null);
    }

    /** QUEUED/RUNNING → FAILED. currentStage keeps pointing at the stage where it stopped. */
    public JobRecord fail(FailureKind kind, String error, Instant at) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status.wireName());
        }
        String message = (error == null || error.isBlank()) ? "Unknown error" : error;
        return new JobRecord(id, JobStatus.FAILED, currentStage, description, options,
                createdAt, null, at, stagesCompleted, null, List.of(message), kind);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** completedAt or failedAt, whichever is set; null while the job is live. */
    @JsonIgnore
    public Instant finishedAt() {
        return completedAt != null ? completedAt : failedAt;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<PipelineStage> append(PipelineStage stage) {
        List<PipelineStage> next = new ArrayList<>(stagesCompleted);
        next.add(stage);
        return next;
    }

    private void requireStatus(JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Job %s is %s, expected %s"
                    .formatted(id, status.wireName(), expected.wireName()));
        }
    }

    private void requireCurrent(PipelineStage stage) {
        if (currentStage != stage) {
            throw new IllegalStateException("Job %s is at stage %s, not %s"
                    .formatted(id, currentStage.wireName(), stage.wireName()));
        }
    }

    private static void checkInvariants(JobStatus status,
                                        PipelineStage currentStage,
                                        Instant completedAt,
                                        Instant failedAt,
                                        List<PipelineStage> stagesCompleted,
                                        PipelineResult result,
                                        List<String> errors,
                                        FailureKind failureKind) {
        int done = stagesCompleted.size();
        if (done > PipelineStage.PIPELINE.size()
                || !PipelineStage.PIPELINE.subList(0, done).equals(stagesCompleted)) {
            throw new IllegalStateException("stagesCompleted is not a prefix of the pipeline: " + stagesCompleted);
        }
        if (completedAt != null && failedAt != null) {
            throw new IllegalStateException("completedAt and failedAt are mutually exclusive");
        }
        if (result != null && !errors.isEmpty()) {
            throw new IllegalStateException("result and errors are mutually exclusive");
        }

        switch (status) {
            case QUEUED, RUNNING -> {
                if (completedAt != null || failedAt != null || result != null
                        || !errors.isEmpty() || failureKind != null) {
                    throw new IllegalStateException("A live job carries no outcome");
                }
                if (done == PipelineStage.PIPELINE.size()
                        || currentStage != PipelineStage.PIPELINE.get(done)) {
                    throw new IllegalStateException("currentStage " + currentStage
                            + " does not follow " + stagesCompleted);
                }
                if (status == JobStatus.QUEUED && done > 0) {
                    throw new IllegalStateException("A queued job has no completed stages");
                }
            }
            case COMPLETE -> {
                if (currentStage != PipelineStage.DONE || result == null || completedAt == null
                        || done != PipelineStage.PIPELINE.size()) {
                    throw new IllegalStateException("A complete job must be DONE with a result and completedAt");
                }
            }
            case FAILED -> {
                if (errors.isEmpty() || failureKind == null || failedAt == null) {
                    throw new IllegalStateException("A failed job must carry errors, failureKind and failedAt");
                }
                if (done == PipelineStage.PIPELINE.size()
                        || currentStage != PipelineStage.PIPELINE.get(done)) {
                    throw new IllegalStateException("A failed job must stop at an unfinished stage");
                }
            }
        }
    }
}
