package com.mcpfactory.orchestrator.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PatternComplianceChecker over hand-written entry points.
 */
class PatternComplianceCheckerTest {

    private final PatternComplianceChecker checker = new PatternComplianceChecker();

    private static final String COMPLIANT = """
            server.setRequestHandler(ListToolsRequestSchema, async () => ({
              tools: [
                { name: 'get_forecast', inputSchema: { type: 'object', required: ['city'] } }
              ]
            }));
            server.setRequestHandler(CallToolRequestSchema, async (request) => {
              switch (request.params.name) {
                case 'get_forecast':
                  return forecast();
                default:
                  throw new Error('unknown');
              }
            });
            await server.connect(transport);
            """;

    @Test
    void check_compliantDocument_hasNoIssues() {
        ComplianceReport report = checker.check(COMPLIANT);

        assertThat(report.compliant()).isTrue();
        assertThat(report.issues()).isEmpty();
    }

    @Test
    void check_declaredToolWithoutHandler_isFatal() {
        String source = COMPLIANT.replace("case 'get_forecast':", "");

        ComplianceReport report = checker.check(source);

        assertThat(report.compliant()).isFalse();
        assertThat(report.issues()).containsExactly("Missing tool handler for 'get_forecast'");
    }

    @Test
    void check_handlerForUndeclaredTool_isWarningOnly() {
        String source = COMPLIANT.replace("default:", "case 'legacy_tool':\n      return legacy();\n    default:");

        ComplianceReport report = checker.check(source);

        assertThat(report.compliant()).isTrue();
        assertThat(report.issues()).containsExactly("Handler for undeclared tool 'legacy_tool'");
        assertThat(report.warnings()).hasSize(1);
        assertThat(report.fatalIssues()).isEmpty();
    }

    @Test
    void check_everyUnmatchedDeclaredTool_isReportedOnce() {
        String source = """
                server.setRequestHandler(ListToolsRequestSchema, async () => ({
                  tools: [ { name: 'a', inputSchema: { type: 'object' } },
                           { name: 'b', inputSchema: { type: 'object' } },
                           { name: 'c', inputSchema: { type: 'object' } } ]
                }));
                server.setRequestHandler(CallToolRequestSchema, async (request) => {
                  switch (request.params.name) { case 'b': return 1; }
                });
                server.connect(t);
                """;

        ComplianceReport report = checker.check(source);

        assertThat(report.compliant()).isFalse();
        assertThat(report.issues()).containsExactly(
                "Missing tool handler for 'a'",
                "Missing tool handler for 'c'");
    }

    @Test
    void check_schemaWithoutType_isWarningOnly() {
        String source = COMPLIANT.replace("inputSchema: { type: 'object', required: ['city'] }",
                                          "inputSchema: { properties: { city: { type: 'string' } } }");

        ComplianceReport report = checker.check(source);

        assertThat(report.compliant()).isTrue();
        assertThat(report.issues()).containsExactly("inputSchema missing \"type\" property");
    }

    @Test
    void check_missingMarkersAndTransport_areFatal() {
        String source = "tools: [ { name: 'x' } ]\ncase 'x': break;";

        ComplianceReport report = checker.check(source);

        assertThat(report.compliant()).isFalse();
        assertThat(report.issues()).containsExactly(
                "Missing ListToolsRequestSchema handler",
                "Missing CallToolRequestSchema handler",
                "Missing server connection/run call");
    }

    @Test
    void check_runCallSatisfiesTransport() {
        String source = COMPLIANT.replace("await server.connect(transport);", "app.run();");
        assertThat(checker.check(source).compliant()).isTrue();
    }

    @Test
    void check_noToolsAtAll_isVacuouslyCovered() {
        String source = """
                server.setRequestHandler(ListToolsRequestSchema, async () => ({ tools: [] }));
                server.setRequestHandler(CallToolRequestSchema, async () => ({}));
                server.connect(t);
                """;

        assertThat(checker.check(source).issues()).isEmpty();
    }

    @Test
    void check_blankDocument_yieldsSingleFatalIssue() {
        for (String blank : new String[] {null, "", "   \n"}) {
            ComplianceReport report = checker.check(blank);
            assertThat(report.compliant()).isFalse();
            assertThat(report.issues()).containsExactly("Empty source document");
        }
    }
}
