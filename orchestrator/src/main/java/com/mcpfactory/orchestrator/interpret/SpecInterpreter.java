package com.mcpfactory.orchestrator.interpret;

/**
 * Turns a free-text description into a {@link ServerSpec}.
 */
public interface SpecInterpreter {

    /**
     * @param description what the server should do, in plain language
     * @param runtime     target runtime ("typescript")
     * @throws SpecInterpretationException if no usable spec could be produced
     */
    ServerSpec interpret(String description, String runtime);
}
