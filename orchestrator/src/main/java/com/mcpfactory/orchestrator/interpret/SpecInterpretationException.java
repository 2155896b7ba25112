package com.mcpfactory.orchestrator.interpret;

/**
 * Thrown when the interpreter reply cannot be turned into a valid spec.
 */
public class SpecInterpretationException extends RuntimeException {

    public SpecInterpretationException(String message) {
        super(message);
    }

    public SpecInterpretationException(String message, Throwable cause) {
        super(message, cause);
    }
}
