package com.mcpfactory.orchestrator.executor;

import java.time.Duration;

/**
 * Outcome of one external command.
 *
 * @param exitCode process exit code; -1 when the process was killed on timeout
 * @param timedOut true if the wall-clock limit was hit and the process destroyed
 */
public record ExecutionResult(
        int      exitCode,
        String   stdout,
        String   stderr,
        Duration elapsed,
        boolean  timedOut
) {
    public ExecutionResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    /** True if the command ran to completion with exit code 0. */
    public boolean success() {
        return !timedOut && exitCode == 0;
    }

    /** stdout followed by stderr, for tools that report on either stream. */
    public String combinedOutput() {
        StringBuilder sb = new StringBuilder();
        if (!stdout.isBlank()) {
            sb.append(stdout.stripTrailing());
        }
        if (!stderr.isBlank()) {
            if (!sb.isEmpty()) sb.append("\n");
            sb.append(stderr.stripTrailing());
        }
        return sb.toString();
    }
}
