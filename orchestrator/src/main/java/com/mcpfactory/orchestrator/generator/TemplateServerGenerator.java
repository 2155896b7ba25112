package com.mcpfactory.orchestrator.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpfactory.orchestrator.interpret.ResourceSpec;
import com.mcpfactory.orchestrator.interpret.ServerSpec;
import com.mcpfactory.orchestrator.interpret.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Template-based {@link ServerGenerator} for the TypeScript runtime.
 *
 * Layout of the generated tree:
 * <pre>
 *   mcp-&lt;name&gt;/
 *     package.json, tsconfig.json, README.md, Dockerfile, claude_desktop_config.json
 *     src/index.ts        server wiring: tool list, call dispatch, stdio transport
 *     src/schemas.ts      zod schema per tool
 *     src/client.ts       upstream HTTP client with auth headers
 *     src/tools/*.ts      one stub per tool
 *     src/resources/*.ts  one stub per resource
 * </pre>
 * Output is a pure function of the spec and the output root.
 */
@Component
public class TemplateServerGenerator implements ServerGenerator {

    private static final Logger log = LoggerFactory.getLogger(TemplateServerGenerator.class);

    private final ObjectMapper        json;
    private final TypeScriptTemplates templates;

    public TemplateServerGenerator(ObjectMapper objectMapper) {
        this.json      = objectMapper;
        this.templates = new TypeScriptTemplates(objectMapper);
    }

    @Override
    public GeneratedServer generate(ServerSpec spec, Path outputRoot) {
        if (spec == null || spec.name() == null || spec.name().isBlank()) {
            throw new GenerationException("Cannot generate a server without a name");
        }
        Path serverDir = outputRoot.resolve(spec.packageName()).toAbsolutePath().normalize();

        Map<String, String> files = new LinkedHashMap<>();
        files.put("package.json",               packageJson(spec));
        files.put("tsconfig.json",              tsConfig());
        files.put("src/index.ts",               templates.index(spec));
        files.put("src/schemas.ts",             templates.schemas(spec));
        files.put("src/client.ts",              templates.client(spec));
        String clientConfig = clientConfig(spec, serverDir);
        files.put("README.md",                  templates.readme(spec, indexJs(serverDir), clientConfig));
        files.put("Dockerfile",                 templates.dockerfile(spec));
        files.put("claude_desktop_config.json", clientConfig);
        for (ToolSpec tool : spec.tools()) {
            files.put("src/tools/" + tool.name() + ".ts", templates.tool(tool));
        }
        for (ResourceSpec resource : spec.resources()) {
            files.put("src/resources/" + resource.name() + ".ts", templates.resource(resource));
        }

        try {
            Files.createDirectories(serverDir.resolve("src/tools"));
            Files.createDirectories(serverDir.resolve("src/resources"));
            Files.createDirectories(serverDir.resolve("tests"));
            for (Map.Entry<String, String> file : files.entrySet()) {
                Files.writeString(serverDir.resolve(file.getKey()), file.getValue(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new GenerationException("Failed to write server to " + serverDir + ": " + e.getMessage(), e);
        }

        log.info("Generated {} file(s) in {}", files.size(), serverDir);
        return new GeneratedServer(serverDir, new ArrayList<>(files.keySet()));
    }

    // ------------------------------------------------------------------
    // JSON files
    // ------------------------------------------------------------------

    private String packageJson(ServerSpec spec) {
        Map<String, Object> pkg = new LinkedHashMap<>();
        pkg.put("name",        spec.packageName());
        pkg.put("version",     spec.version());
        pkg.put("description", spec.description());
        pkg.put("main",        "dist/index.js");
        pkg.put("types",       "dist/index.d.ts");
        pkg.put("scripts", ordered(
                "build", "tsc",
                "start", "node dist/index.js",
                "dev",   "ts-node src/index.ts",
                "test",  "jest"));
        pkg.put("dependencies", ordered(
                "@modelcontextprotocol/sdk", "^1.0.0",
                "zod",                       "^3.22.0"));
        pkg.put("devDependencies", ordered(
                "@types/node", "^20.0.0",
                "typescript",  "^5.3.0",
                "ts-node",     "^10.9.0",
                "jest",        "^29.0.0",
                "@types/jest", "^29.0.0"));
        pkg.put("engines", Map.of("node", ">=18.0.0"));
        return pretty(pkg);
    }

    private String tsConfig() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("target",           "ES2022");
        options.put("module",           "commonjs");
        options.put("lib",              List.of("ES2022"));
        options.put("outDir",           "./dist");
        options.put("rootDir",          "./src");
        options.put("strict",           true);
        options.put("esModuleInterop",  true);
        options.put("skipLibCheck",     true);
        options.put("forceConsistentCasingInFileNames", true);
        options.put("declaration",      true);

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("compilerOptions", options);
        config.put("include",         List.of("src/**/*"));
        config.put("exclude",         List.of("node_modules", "dist"));
        return pretty(config);
    }

    /** Claude Desktop {@code mcpServers} entry pointing at the built server. */
    private String clientConfig(ServerSpec spec, Path serverDir) {
        Map<String, Object> server = new LinkedHashMap<>();
        server.put("command", "node");
        server.put("args",    List.of(indexJs(serverDir)));
        if (spec.auth().hasEnvVar()) {
            String env = spec.auth().envVar();
            server.put("env", Map.of(env, "${" + env + "}"));
        }
        return pretty(Map.of("mcpServers", Map.of(spec.name(), server)));
    }

    private static String indexJs(Path serverDir) {
        return serverDir.resolve("dist").resolve("index.js").toString();
    }

    private static Map<String, String> ordered(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private String pretty(Object value) {
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            throw new GenerationException("Failed to render JSON: " + e.getOriginalMessage(), e);
        }
    }
}
