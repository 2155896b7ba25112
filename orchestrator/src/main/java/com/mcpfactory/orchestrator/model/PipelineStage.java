package com.mcpfactory.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Stages of the generation pipeline, in canonical order.
 *
 * Happy path:
 *   INTERPRET → GENERATE → VALIDATE → PACKAGE → REGISTER → DONE
 *
 * DONE is not a stage that runs; it is the marker a job's currentStage moves
 * to once REGISTER has finished. Stages are never reordered or skipped.
 */
public enum PipelineStage {
    INTERPRET,   // free text → ServerSpec
    GENERATE,    // ServerSpec → server source tree
    VALIDATE,    // static checks over the generated tree
    PACKAGE,     // build, tarball, optional container image
    REGISTER,    // upsert into the server registry
    DONE;

    // Ordered list of runnable stages. Defines the pipeline sequence.
    public static final List<PipelineStage> PIPELINE = List.of(
            INTERPRET,
            GENERATE,
            VALIDATE,
            PACKAGE,
            REGISTER
    );

    /** Lowercase name used on the wire and in logs ("interpret", "done", ...). */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** The stage that follows this one, or DONE after the last runnable stage. */
    public PipelineStage next() {
        if (this == DONE) {
            throw new IllegalStateException("DONE has no next stage");
        }
        int idx = PIPELINE.indexOf(this);
        return idx < PIPELINE.size() - 1 ? PIPELINE.get(idx + 1) : DONE;
    }

    public boolean isLast() {
        return this == REGISTER;
    }
}
