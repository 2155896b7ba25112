package com.mcpfactory.orchestrator.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates a generated server directory.
 *
 * Checks, in report order:
 * <ol>
 *   <li>TypeScript: {@code tsc --noEmit} with the server's local compiler</li>
 *   <li>Lint: ESLint, only when the server ships an ESLint config</li>
 *   <li>Protocol: {@link ComplianceChecker} over {@code src/index.ts}</li>
 *   <li>Dependencies: required packages in {@code package.json}</li>
 * </ol>
 * A missing toolchain (no {@code node_modules}, no local {@code tsc}) is a
 * TOOLCHAIN warning: a freshly generated tree has not been installed yet.
 */
@Component
public class ServerValidator {

    private static final Logger log = LoggerFactory.getLogger(ServerValidator.class);

    // src/index.ts(42,5): error TS2322: Type 'string' is not assignable to type 'number'.
    private static final Pattern TSC_ERROR = Pattern.compile(
            "(.+?)\\((\\d+),(\\d+)\\):\\s*error\\s+TS\\d+:\\s*(.+)");

    private static final Pattern LEADING_MAJOR = Pattern.compile("^\\D*(\\d+)");

    private static final List<String> ESLINT_CONFIGS = List.of(
            ".eslintrc", ".eslintrc.js", ".eslintrc.json", "eslint.config.js");

    private static final List<String> REQUIRED_DEPENDENCIES = List.of("@modelcontextprotocol/sdk", "zod");

    private static final int MIN_NODE_MAJOR = 18;

    private final CommandExecutor   executor;
    private final ComplianceChecker complianceChecker;
    private final ObjectMapper      json;
    private final Duration          typecheckTimeout;
    private final Duration          lintTimeout;

    public ServerValidator(CommandExecutor executor,
                           ComplianceChecker complianceChecker,
                           ObjectMapper objectMapper,
                           FactoryProperties properties) {
        this.executor          = executor;
        this.complianceChecker = complianceChecker;
        this.json              = objectMapper;
        this.typecheckTimeout  = properties.getCommands().getTypecheckTimeout();
        this.lintTimeout       = properties.getCommands().getLintTimeout();
    }

    public ValidationReport validate(Path serverDir) {
        if (serverDir == null || !Files.isDirectory(serverDir)) {
            return ValidationReport.of(
                    List.of(ValidationIssue.of(IssueCategory.FILESYSTEM, "Directory not found: " + serverDir)),
                    List.of());
        }

        List<ValidationIssue> errors   = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        checkTypeScript(serverDir, errors, warnings);
        checkLint(serverDir, errors, warnings);
        checkProtocol(serverDir, errors, warnings);
        checkDependencies(serverDir, errors, warnings);

        ValidationReport report = ValidationReport.of(errors, warnings);
        log.info("Validated {}: {} error(s), {} warning(s)",
                serverDir, report.errors().size(), report.warnings().size());
        return report;
    }

    // ------------------------------------------------------------------
    // TypeScript
    // ------------------------------------------------------------------

    private void checkTypeScript(Path dir, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        if (!Files.exists(dir.resolve("tsconfig.json"))) {
            errors.add(ValidationIssue.at(IssueCategory.TYPESCRIPT, "tsconfig.json", null, "tsconfig.json not found"));
            return;
        }
        if (!Files.isDirectory(dir.resolve("node_modules"))) {
            warnings.add(ValidationIssue.of(IssueCategory.TOOLCHAIN,
                    "node_modules not found - run \"npm install\" first; type check skipped"));
            return;
        }
        Path tsc = dir.resolve("node_modules/.bin/tsc");
        if (!Files.exists(tsc)) {
            warnings.add(ValidationIssue.of(IssueCategory.TOOLCHAIN,
                    "typescript not installed - run \"npm install\" first; type check skipped"));
            return;
        }

        ExecutionResult result;
        try {
            result = executor.run(List.of(tsc.toString(), "--noEmit"), dir, typecheckTimeout);
        } catch (ExecutorException e) {
            warnings.add(ValidationIssue.of(IssueCategory.TOOLCHAIN, "Could not run tsc: " + e.getMessage()));
            return;
        }
        if (result.timedOut()) {
            errors.add(ValidationIssue.of(IssueCategory.TYPESCRIPT,
                    "TypeScript check timed out after " + typecheckTimeout.toSeconds() + "s"));
            return;
        }
        if (result.exitCode() == 0) {
            return;
        }

        String output = result.combinedOutput();
        int before = errors.size();
        Matcher m = TSC_ERROR.matcher(output);
        while (m.find()) {
            errors.add(ValidationIssue.at(IssueCategory.TYPESCRIPT,
                    m.group(1).strip(), Integer.parseInt(m.group(2)), m.group(4).strip()));
        }
        if (errors.size() == before) {
            errors.add(ValidationIssue.of(IssueCategory.TYPESCRIPT,
                    output.isBlank() ? "TypeScript compilation failed" : output.strip()));
        }
    }

    // ------------------------------------------------------------------
    // ESLint
    // ------------------------------------------------------------------

    private void checkLint(Path dir, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        boolean configured = ESLINT_CONFIGS.stream().anyMatch(c -> Files.exists(dir.resolve(c)));
        if (!configured) {
            log.debug("ESLint skipped for {} (no config)", dir);
            return;
        }

        ExecutionResult result;
        try {
            result = executor.run(List.of("npx", "eslint", "src/", "--format", "json"), dir, lintTimeout);
        } catch (ExecutorException e) {
            warnings.add(ValidationIssue.of(IssueCategory.TOOLCHAIN, "Could not run eslint: " + e.getMessage()));
            return;
        }
        if (result.timedOut()) {
            warnings.add(ValidationIssue.of(IssueCategory.TOOLCHAIN,
                    "ESLint timed out after " + lintTimeout.toSeconds() + "s"));
            return;
        }

        // eslint exits non-zero when it finds errors; the JSON report is on stdout either way.
        String out = result.stdout().strip();
        if (!out.startsWith("[")) {
            warnings.add(ValidationIssue.of(IssueCategory.TOOLCHAIN, "ESLint produced no JSON report"));
            return;
        }
        try {
            for (JsonNode file : json.readTree(out)) {
                String path = relativize(dir, file.path("filePath").asText(""));
                for (JsonNode msg : file.path("messages")) {
                    String rule = msg.path("ruleId").asText("");
                    String text = msg.path("message").asText("") + (rule.isEmpty() ? "" : " (" + rule + ")");
                    ValidationIssue issue = ValidationIssue.at(IssueCategory.LINT, path, msg.path("line").asInt(0), text);
                    if (msg.path("severity").asInt() == 2) {
                        errors.add(issue);
                    } else {
                        warnings.add(issue);
                    }
                }
            }
        } catch (JsonProcessingException e) {
            warnings.add(ValidationIssue.of(IssueCategory.TOOLCHAIN,
                    "Could not parse ESLint output: " + e.getOriginalMessage()));
        }
    }

    // ------------------------------------------------------------------
    // Protocol compliance
    // ------------------------------------------------------------------

    private void checkProtocol(Path dir, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        Path index = dir.resolve("src/index.ts");
        if (!Files.exists(index)) {
            errors.add(ValidationIssue.at(IssueCategory.PROTOCOL, "src/index.ts", null, "Missing src/index.ts"));
            return;
        }

        String source;
        try {
            source = Files.readString(index, StandardCharsets.UTF_8);
        } catch (IOException e) {
            errors.add(ValidationIssue.at(IssueCategory.PROTOCOL, "src/index.ts", null,
                    "Cannot read src/index.ts: " + e.getMessage()));
            return;
        }

        ComplianceReport report = complianceChecker.check(source);
        for (ComplianceIssue finding : report.findings()) {
            ValidationIssue issue = ValidationIssue.at(IssueCategory.PROTOCOL, "src/index.ts", null, finding.message());
            if (finding.fatal()) {
                errors.add(issue);
            } else {
                warnings.add(issue);
            }
        }
    }

    // ------------------------------------------------------------------
    // package.json
    // ------------------------------------------------------------------

    private void checkDependencies(Path dir, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        Path pkgPath = dir.resolve("package.json");
        if (!Files.exists(pkgPath)) {
            errors.add(ValidationIssue.at(IssueCategory.DEPENDENCY, "package.json", null, "package.json not found"));
            return;
        }

        JsonNode pkg;
        try {
            pkg = json.readTree(pkgPath.toFile());
        } catch (IOException e) {
            errors.add(ValidationIssue.at(IssueCategory.DEPENDENCY, "package.json", null,
                    "package.json is not valid JSON: " + e.getMessage()));
            return;
        }

        for (String dep : REQUIRED_DEPENDENCIES) {
            if (!declares(pkg, dep)) {
                errors.add(ValidationIssue.at(IssueCategory.DEPENDENCY, "package.json", null,
                        "Missing required dependency: " + dep));
            }
        }
        if (!declares(pkg, "typescript")) {
            warnings.add(ValidationIssue.at(IssueCategory.DEPENDENCY, "package.json", null,
                    "typescript not in devDependencies"));
        }

        String nodeRange = pkg.path("engines").path("node").asText("");
        Matcher m = LEADING_MAJOR.matcher(nodeRange);
        if (m.find() && Integer.parseInt(m.group(1)) < MIN_NODE_MAJOR) {
            warnings.add(ValidationIssue.at(IssueCategory.DEPENDENCY, "package.json", null,
                    "Node version " + nodeRange + " may be too old for MCP SDK"));
        }
    }

    private static boolean declares(JsonNode pkg, String dep) {
        return pkg.path("dependencies").has(dep) || pkg.path("devDependencies").has(dep);
    }

    private static String relativize(Path dir, String file) {
        if (file.isEmpty()) return null;
        try {
            return dir.toAbsolutePath().relativize(Path.of(file).toAbsolutePath()).toString();
        } catch (IllegalArgumentException e) {
            return file;
        }
    }
}
