package com.mcpfactory.orchestrator.service;

/**
 * Malformed submission. Raised before a job exists, so nothing is stored.
 */
public class InvalidSubmissionException extends RuntimeException {
    public InvalidSubmissionException(String message) {
        super(message);
    }
}
