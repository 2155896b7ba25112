package com.mcpfactory.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a pipeline job.
 *
 * Transitions:
 *   QUEUED  → RUNNING   (a worker picked the job up)
 *   RUNNING → COMPLETE  (REGISTER finished)
 *   RUNNING → FAILED    (fatal stage failure or internal error)
 *   QUEUED  → FAILED    (internal error before the first stage)
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETE,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
