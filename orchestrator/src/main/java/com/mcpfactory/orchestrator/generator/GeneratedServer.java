package com.mcpfactory.orchestrator.generator;

import java.nio.file.Path;
import java.util.List;

/**
 * @param serverDir absolute root of the generated tree
 * @param files     written files, relative to serverDir, in write order
 */
public record GeneratedServer(Path serverDir, List<String> files) {
    public GeneratedServer {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
