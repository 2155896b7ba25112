package com.mcpfactory.orchestrator.service;

/**
 * Body of one pipeline stage. May throw anything; {@link StageRunner}
 * turns the throw into a failed {@link StageResult}.
 */
@FunctionalInterface
public interface StageCall<T> {
    T call() throws Exception;
}
