package com.mcpfactory.orchestrator.validation;

/**
 * One finding of the compliance checker.
 *
 * @param fatal true if the finding alone makes the document non-compliant
 */
public record ComplianceIssue(Check check, boolean fatal, String message) {

    public enum Check {
        SOURCE,             // nothing to check
        PROTOCOL_MARKERS,   // ListTools / CallTool schemas referenced
        TOOL_COVERAGE,      // declared vs handled tool names
        INPUT_SCHEMA,       // inputSchema literals carry a type
        TRANSPORT           // server is connected to a transport
    }

    public static ComplianceIssue fatal(Check check, String message) {
        return new ComplianceIssue(check, true, message);
    }

    public static ComplianceIssue warning(Check check, String message) {
        return new ComplianceIssue(check, false, message);
    }
}
