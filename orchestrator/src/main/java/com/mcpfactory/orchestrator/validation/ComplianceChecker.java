package com.mcpfactory.orchestrator.validation;

/**
 * Structural protocol checks over a server entry point's source text.
 * Implementations are stateless and safe to call from any worker.
 */
public interface ComplianceChecker {

    /** Never throws; a null or blank document yields a single fatal finding. */
    ComplianceReport check(String sourceDocument);
}
