package com.mcpfactory.orchestrator.generator;

import com.mcpfactory.orchestrator.interpret.ServerSpec;

import java.nio.file.Path;

/**
 * Emits a server source tree for a {@link ServerSpec}.
 */
public interface ServerGenerator {

    /**
     * Write the server under {@code outputRoot/mcp-<name>/}, replacing files
     * that already exist there.
     *
     * @throws GenerationException on any I/O failure
     */
    GeneratedServer generate(ServerSpec spec, Path outputRoot);
}
