package com.mcpfactory.orchestrator.packaging;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * @param packagePath  tarball location, or null if {@code npm pack} failed
 * @param dockerImage  image tag, or null if no image was built
 * @param manifest     contents of manifest.json
 * @param clientConfig Claude Desktop {@code mcpServers} entry for the server
 * @param warnings     non-fatal problems (tarball or image not produced)
 */
public record PackageResult(
        String              packagePath,
        String              dockerImage,
        Path                manifestPath,
        Map<String, Object> manifest,
        Map<String, Object> clientConfig,
        List<String>        warnings
) {
    public PackageResult {
        manifest     = manifest == null ? Map.of() : manifest;
        clientConfig = clientConfig == null ? Map.of() : clientConfig;
        warnings     = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
