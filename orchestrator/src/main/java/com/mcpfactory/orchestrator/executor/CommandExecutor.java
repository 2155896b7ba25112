package com.mcpfactory.orchestrator.executor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs build and lint tools (tsc, eslint, npm, docker) against a server tree.
 */
public interface CommandExecutor {

    /**
     * Run {@code command} in {@code workingDir}, killing it after {@code timeout}.
     * A non-zero exit or a timeout is reported in the result, not thrown.
     *
     * @throws ExecutorException if the process cannot be started
     */
    ExecutionResult run(List<String> command, Path workingDir, Duration timeout);

    /**
     * Like {@link #run}, but a timeout or non-zero exit becomes an
     * {@link ExecutorException} carrying the tool's output.
     */
    default ExecutionResult runChecked(List<String> command, Path workingDir, Duration timeout) {
        ExecutionResult result = run(command, workingDir, timeout);
        String cmd = String.join(" ", command);
        if (result.timedOut()) {
            throw new ExecutorException(cmd + " timed out after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            String output = result.stderr().isBlank() ? result.stdout() : result.stderr();
            throw new ExecutorException(cmd + " failed with exit code " + result.exitCode()
                    + (output.isBlank() ? "" : ": " + output.strip()));
        }
        return result;
    }
}
