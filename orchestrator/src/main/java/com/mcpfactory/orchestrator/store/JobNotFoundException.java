package com.mcpfactory.orchestrator.store;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String id) {
        super("Job not found: " + id);
    }
}
