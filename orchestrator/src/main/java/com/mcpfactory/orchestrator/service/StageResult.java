package com.mcpfactory.orchestrator.service;

/**
 * Outcome of one stage invocation.
 *
 * @param output present when success is true
 * @param error  present when success is false; never blank
 * @param cause  the exception behind a failure, kept for classification
 */
public record StageResult<T>(boolean success, T output, String error, Throwable cause) {

    public static <T> StageResult<T> success(T output) {
        return new StageResult<>(true, output, null, null);
    }

    public static <T> StageResult<T> failure(String error, Throwable cause) {
        return new StageResult<>(false, null, error, cause);
    }
}
