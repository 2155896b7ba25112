package com.mcpfactory.orchestrator.packaging;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param docker     also build a container image
 * @param packageDir where tarballs are moved after {@code npm pack}
 */
public record PackageOptions(boolean docker, Path packageDir) {
    public PackageOptions {
        Objects.requireNonNull(packageDir, "packageDir");
    }
}
