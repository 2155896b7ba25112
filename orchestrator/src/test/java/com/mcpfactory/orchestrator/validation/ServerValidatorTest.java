package com.mcpfactory.orchestrator.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpfactory.orchestrator.TestSpecs;
import com.mcpfactory.orchestrator.config.FactoryProperties;
import com.mcpfactory.orchestrator.executor.CommandExecutor;
import com.mcpfactory.orchestrator.executor.ExecutionResult;
import com.mcpfactory.orchestrator.generator.TemplateServerGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ServerValidator.
 *
 * Server trees come from the real generator in a temp dir; external tools
 * are mocked through CommandExecutor, so no node or npm is needed.
 */
@ExtendWith(MockitoExtension.class)
class ServerValidatorTest {

    @Mock CommandExecutor executor;
    @TempDir Path tmp;

    ObjectMapper    json = new ObjectMapper();
    ServerValidator validator;
    Path            serverDir;

    @BeforeEach
    void setUp() {
        validator = new ServerValidator(executor, new PatternComplianceChecker(), json, new FactoryProperties());
        serverDir = new TemplateServerGenerator(json).generate(TestSpecs.weather(), tmp).serverDir();
    }

    @Test
    void validate_missingDirectory_isFilesystemError() {
        ValidationReport report = validator.validate(tmp.resolve("nope"));

        assertThat(report.valid()).isFalse();
        assertThat(report.errors()).singleElement()
                .satisfies(issue -> assertThat(issue.category()).isEqualTo(IssueCategory.FILESYSTEM));
    }

    @Test
    void validate_freshGeneratedTree_isValidWithToolchainWarning() {
        ValidationReport report = validator.validate(serverDir);

        assertThat(report.valid()).isTrue();
        assertThat(report.errors()).isEmpty();
        assertThat(report.warnings()).extracting(ValidationIssue::category)
                .containsExactly(IssueCategory.TOOLCHAIN);
        verifyNoInteractions(executor);
    }

    @Test
    void validate_tscErrors_areParsedPerLine() throws IOException {
        installFakeTsc();
        when(executor.run(argThat(cmd -> cmd.contains("--noEmit")), any(), any()))
                .thenReturn(new ExecutionResult(2, """
                        src/index.ts(12,5): error TS2322: Type 'string' is not assignable to type 'number'.
                        src/client.ts(3,1): error TS2304: Cannot find name 'fetch'.
                        """, "", Duration.ofSeconds(1), false));

        ValidationReport report = validator.validate(serverDir);

        assertThat(report.valid()).isFalse();
        assertThat(report.errors()).hasSize(2);
        ValidationIssue first = report.errors().get(0);
        assertThat(first.category()).isEqualTo(IssueCategory.TYPESCRIPT);
        assertThat(first.file()).isEqualTo("src/index.ts");
        assertThat(first.line()).isEqualTo(12);
        assertThat(first.message()).startsWith("Type 'string'");
        assertThat(first.format()).isEqualTo(
                "[typescript] src/index.ts:12 - Type 'string' is not assignable to type 'number'.");
    }

    @Test
    void validate_tscTimeout_isTypescriptError() throws IOException {
        installFakeTsc();
        when(executor.run(any(), any(), any()))
                .thenReturn(new ExecutionResult(-1, "", "", Duration.ofSeconds(60), true));

        ValidationReport report = validator.validate(serverDir);

        assertThat(report.errors()).extracting(ValidationIssue::message)
                .containsExactly("TypeScript check timed out after 60s");
    }

    @Test
    void validate_eslintFindings_splitBySeverity() throws IOException {
        Files.writeString(serverDir.resolve(".eslintrc.json"), "{}");
        String eslintJson = """
                [{"filePath":"%s","messages":[
                  {"ruleId":"no-unused-vars","severity":2,"message":"'x' is unused","line":4},
                  {"ruleId":null,"severity":1,"message":"Prefer const","line":9}
                ]}]
                """.formatted(serverDir.resolve("src/index.ts").toString().replace("\\", "\\\\"));
        when(executor.run(argThat(cmd -> cmd.contains("eslint")), any(), any()))
                .thenReturn(new ExecutionResult(1, eslintJson, "", Duration.ofSeconds(2), false));

        ValidationReport report = validator.validate(serverDir);

        assertThat(report.errors()).singleElement().satisfies(issue -> {
            assertThat(issue.category()).isEqualTo(IssueCategory.LINT);
            assertThat(issue.file()).isEqualTo(Path.of("src", "index.ts").toString());
            assertThat(issue.line()).isEqualTo(4);
            assertThat(issue.message()).isEqualTo("'x' is unused (no-unused-vars)");
        });
        assertThat(report.warnings()).extracting(ValidationIssue::message)
                .contains("Prefer const");
    }

    @Test
    void validate_protocolFindings_splitIntoErrorsAndWarnings() throws IOException {
        Path index = serverDir.resolve("src/index.ts");
        String source = Files.readString(index)
                .replace("case 'get_alerts':", "case 'legacy_tool':");
        Files.writeString(index, source);

        ValidationReport report = validator.validate(serverDir);

        assertThat(report.errors()).extracting(ValidationIssue::format)
                .containsExactly("[protocol] src/index.ts - Missing tool handler for 'get_alerts'");
        assertThat(report.warnings()).extracting(ValidationIssue::message)
                .contains("Handler for undeclared tool 'legacy_tool'");
    }

    @Test
    void validate_missingIndex_isProtocolError() throws IOException {
        Files.delete(serverDir.resolve("src/index.ts"));

        ValidationReport report = validator.validate(serverDir);

        assertThat(report.errors()).extracting(ValidationIssue::category)
                .containsExactly(IssueCategory.PROTOCOL);
    }

    @Test
    void validate_dependencyProblems() throws IOException {
        Files.writeString(serverDir.resolve("package.json"), """
                {
                  "name": "mcp-weather",
                  "dependencies": { "@modelcontextprotocol/sdk": "^1.0.0" },
                  "engines": { "node": ">=16" }
                }
                """);

        ValidationReport report = validator.validate(serverDir);

        assertThat(report.errors()).extracting(ValidationIssue::message)
                .containsExactly("Missing required dependency: zod");
        assertThat(report.warnings()).extracting(ValidationIssue::message)
                .contains("typescript not in devDependencies",
                          "Node version >=16 may be too old for MCP SDK");
    }

    @Test
    void validate_missingTsconfig_isTypescriptError() throws IOException {
        Files.delete(serverDir.resolve("tsconfig.json"));

        ValidationReport report = validator.validate(serverDir);

        assertThat(report.errors()).extracting(ValidationIssue::category)
                .containsExactly(IssueCategory.TYPESCRIPT);
    }

    private void installFakeTsc() throws IOException {
        Path bin = Files.createDirectories(serverDir.resolve("node_modules/.bin"));
        Files.writeString(bin.resolve("tsc"), "#!/bin/sh\n");
    }
}
