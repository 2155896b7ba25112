package com.mcpfactory.orchestrator.packaging;

import java.nio.file.Path;

/**
 * Turns a validated server tree into distributable artifacts.
 */
public interface ServerPackager {

    /**
     * Build the server if needed, produce its artifacts and write
     * {@code manifest.json} into {@code serverDir}.
     *
     * @throws PackagingException if the server cannot be built or the manifest written
     */
    PackageResult pack(Path serverDir, PackageOptions options);
}
