package com.mcpfactory.orchestrator.model;

/**
 * Per-submission knobs.
 *
 * @param runtime target runtime passed to the interpreter ("typescript" by default)
 * @param docker  whether the packager should also build a container image
 */
public record JobOptions(String runtime, boolean docker) {

    public static final String DEFAULT_RUNTIME = "typescript";

    // Compact constructor: default runtime if the caller omits it.
    public JobOptions {
        if (runtime == null || runtime.isBlank()) runtime = DEFAULT_RUNTIME;
    }

    public static JobOptions defaults() {
        return new JobOptions(DEFAULT_RUNTIME, false);
    }
}
