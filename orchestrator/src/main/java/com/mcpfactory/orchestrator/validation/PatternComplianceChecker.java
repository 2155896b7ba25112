package com.mcpfactory.orchestrator.validation;

import com.mcpfactory.orchestrator.validation.ComplianceIssue.Check;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Regex-based {@link ComplianceChecker}.
 *
 * Checks, in report order:
 * <ol>
 *   <li>ListToolsRequestSchema and CallToolRequestSchema are referenced (fatal)</li>
 *   <li>every declared tool has a handler (fatal); every handler has a
 *       declaration, {@code default} excepted (warning)</li>
 *   <li>every inputSchema literal has a type (warning)</li>
 *   <li>the server is connected to a transport (fatal)</li>
 * </ol>
 */
@Component
public class PatternComplianceChecker implements ComplianceChecker {

    private static final String LIST_TOOLS     = "ListToolsRequestSchema";
    private static final String CALL_TOOL      = "CallToolRequestSchema";
    private static final String DEFAULT_BRANCH = "default";

    @Override
    public ComplianceReport check(String source) {
        if (source == null || source.isBlank()) {
            return new ComplianceReport(List.of(ComplianceIssue.fatal(Check.SOURCE, "Empty source document")));
        }

        List<ComplianceIssue> findings = new ArrayList<>();

        if (!source.contains(LIST_TOOLS)) {
            findings.add(ComplianceIssue.fatal(Check.PROTOCOL_MARKERS, "Missing " + LIST_TOOLS + " handler"));
        }
        if (!source.contains(CALL_TOOL)) {
            findings.add(ComplianceIssue.fatal(Check.PROTOCOL_MARKERS, "Missing " + CALL_TOOL + " handler"));
        }

        Set<String> declared = InterfaceExtractor.declaredTools(source);
        Set<String> handled  = InterfaceExtractor.handledTools(source);
        for (String tool : declared) {
            if (!handled.contains(tool)) {
                findings.add(ComplianceIssue.fatal(Check.TOOL_COVERAGE,
                        "Missing tool handler for '" + tool + "'"));
            }
        }
        for (String tool : handled) {
            if (!declared.contains(tool) && !DEFAULT_BRANCH.equals(tool)) {
                findings.add(ComplianceIssue.warning(Check.TOOL_COVERAGE,
                        "Handler for undeclared tool '" + tool + "'"));
            }
        }

        for (String schema : InterfaceExtractor.inputSchemas(source)) {
            if (!InterfaceExtractor.hasTopLevelType(schema)) {
                findings.add(ComplianceIssue.warning(Check.INPUT_SCHEMA,
                        "inputSchema missing \"type\" property"));
            }
        }

        if (!source.contains("server.connect") && !source.contains(".run(")) {
            findings.add(ComplianceIssue.fatal(Check.TRANSPORT, "Missing server connection/run call"));
        }

        return new ComplianceReport(findings);
    }
}
