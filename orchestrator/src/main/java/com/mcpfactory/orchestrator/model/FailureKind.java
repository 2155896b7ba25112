package com.mcpfactory.orchestrator.model;

/**
 * Why a job ended up FAILED.
 *
 * There is no input kind: an empty or malformed submission is rejected
 * with {@code InvalidSubmissionException} before a job exists.
 */
public enum FailureKind {
    COLLABORATOR,   // interpreter, generator, external tool, packager or registry failed
    COMPLIANCE,     // validation found issues in a fatal category
    INTERNAL        // unexpected exception in the orchestrator itself
}
