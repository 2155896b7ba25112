package com.mcpfactory.orchestrator.executor;

/**
 * Thrown when an external command cannot be started, times out, or exits
 * non-zero under {@link CommandExecutor#runChecked}.
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
