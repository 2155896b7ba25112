package com.mcpfactory.orchestrator.packaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpfactory.orchestrator.config.FactoryProperties;
import com.mcpfactory.orchestrator.executor.CommandExecutor;
import com.mcpfactory.orchestrator.executor.ExecutionResult;
import com.mcpfactory.orchestrator.executor.ExecutorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * {@link ServerPackager} for Node servers.
 *
 * Steps:
 *   1. build      {@code npm run build}, skipped when dist/ already has content
 *                 or there is no build script
 *   2. tarball    {@code npm pack}, moved into the package directory
 *   3. image      {@code docker build}, only when requested
 *   4. manifest   manifest.json with a Claude Desktop config snippet
 *
 * A build failure is fatal. A missing tarball or image is a warning: the
 * server is still usable from its directory.
 */
@Component
public class NpmServerPackager implements ServerPackager {

    private static final Logger log = LoggerFactory.getLogger(NpmServerPackager.class);

    private static final String DEFAULT_VERSION = "1.0.0";
    private static final String DEFAULT_MAIN    = "dist/index.js";

    private final CommandExecutor executor;
    private final ObjectMapper    json;
    private final Duration        commandTimeout;
    private final Duration        buildTimeout;

    public NpmServerPackager(CommandExecutor executor,
                             ObjectMapper objectMapper,
                             FactoryProperties properties) {
        this.executor       = executor;
        this.json           = objectMapper;
        this.commandTimeout = properties.getCommands().getTimeout();
        this.buildTimeout   = properties.getCommands().getBuildTimeout();
    }

    @Override
    public PackageResult pack(Path serverDir, PackageOptions options) {
        Path dir = serverDir.toAbsolutePath().normalize();
        JsonNode pkg = readPackageJson(dir);
        String name    = stripScope(pkg.path("name").asText(dir.getFileName().toString()));
        String version = pkg.path("version").asText(DEFAULT_VERSION);
        String main    = pkg.path("main").asText(DEFAULT_MAIN);
        List<String> warnings = new ArrayList<>();

        log.info("Packaging {}@{} from {}", name, version, dir);

        build(dir, pkg);

        String packagePath = null;
        try {
            packagePath = tarball(dir, options.packageDir()).toString();
        } catch (ExecutorException | IOException e) {
            warnings.add("Tarball creation failed: " + e.getMessage());
            log.warn("Tarball creation failed for {}: {}", name, e.getMessage());
        }

        String dockerImage = null;
        if (options.docker()) {
            try {
                dockerImage = dockerImage(dir, name, version, main);
            } catch (ExecutorException | IOException e) {
                warnings.add("Docker build failed: " + e.getMessage());
                log.warn("Docker build failed for {}: {}", name, e.getMessage());
            }
        }

        Map<String, Object> clientConfig = clientConfig(dir, name, main);

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("name",          name);
        manifest.put("version",       version);
        manifest.put("description",   pkg.path("description").asText(""));
        manifest.put("package",       packagePath);
        manifest.put("docker",        dockerImage);
        manifest.put("server_dir",    dir.toString());
        manifest.put("claude_config", clientConfig);
        manifest.put("created_at",    Instant.now().toString());

        Path manifestPath = dir.resolve("manifest.json");
        try {
            Files.writeString(manifestPath,
                    json.writerWithDefaultPrettyPrinter().writeValueAsString(manifest),
                    StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PackagingException("Failed to write " + manifestPath + ": " + e.getMessage(), e);
        }

        log.info("Packaged {}@{} (tarball={}, image={})", name, version, packagePath, dockerImage);
        return new PackageResult(packagePath, dockerImage, manifestPath, manifest, clientConfig, warnings);
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    private void build(Path dir, JsonNode pkg) {
        if (hasContent(dir.resolve("dist"))) {
            log.info("dist/ already has content, skipping build");
            return;
        }
        if (!pkg.path("scripts").has("build")) {
            log.info("No build script in package.json, skipping build");
            return;
        }
        try {
            if (!Files.isDirectory(dir.resolve("node_modules"))) {
                executor.runChecked(List.of("npm", "install"), dir, buildTimeout);
            }
            executor.runChecked(List.of("npm", "run", "build"), dir, buildTimeout);
        } catch (ExecutorException e) {
            throw new PackagingException("Build failed: " + e.getMessage(), e);
        }
    }

    private Path tarball(Path dir, Path packageDir) throws IOException {
        ExecutionResult result = executor.runChecked(List.of("npm", "pack"), dir, commandTimeout);

        // npm prints the tarball file name as the last line.
        String tarballName = result.stdout().lines()
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .reduce((first, second) -> second)
                .orElseThrow(() -> new ExecutorException("npm pack printed no file name"));

        Files.createDirectories(packageDir);
        Path target = packageDir.resolve(tarballName);
        Files.move(dir.resolve(tarballName), target, StandardCopyOption.REPLACE_EXISTING);
        return target.toAbsolutePath();
    }

    private String dockerImage(Path dir, String name, String version, String main) throws IOException {
        String image = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-") + ":" + version;
        Path dockerfile = dir.resolve("Dockerfile");
        if (!Files.exists(dockerfile)) {
            Files.writeString(dockerfile, defaultDockerfile(main), StandardCharsets.UTF_8);
            log.info("Generated Dockerfile for {}", name);
        }
        executor.runChecked(List.of("docker", "build", "-t", image, "."), dir, buildTimeout);
        return image;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JsonNode readPackageJson(Path dir) {
        Path pkgPath = dir.resolve("package.json");
        if (!Files.exists(pkgPath)) {
            throw new PackagingException("package.json not found in " + dir);
        }
        try {
            return json.readTree(pkgPath.toFile());
        } catch (IOException e) {
            throw new PackagingException("Cannot read " + pkgPath + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> clientConfig(Path dir, String name, String main) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("command", "node");
        entry.put("args",    List.of(dir.resolve(main).toString()));
        entry.put("env",     Map.of());
        return Map.of(name, entry);
    }

    private static String defaultDockerfile(String main) {
        return "FROM node:20-alpine\n"
             + "WORKDIR /app\n"
             + "COPY package*.json ./\n"
             + "RUN npm ci --omit=dev\n"
             + "COPY dist/ ./dist/\n"
             + "CMD [\"node\", \"" + main + "\"]\n";
    }

    private boolean hasContent(Path dir) {
        if (!Files.isDirectory(dir)) return false;
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isPresent();
        } catch (IOException e) {
            log.warn("Cannot list {}, assuming it is empty: {}", dir, e.getMessage());
            return false;
        }
    }

    private static String stripScope(String name) {
        return name.replaceFirst("^@.*/", "");
    }
}
