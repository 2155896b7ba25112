package com.mcpfactory.orchestrator.store;

public class DuplicateJobException extends RuntimeException {
    public DuplicateJobException(String id) {
        super("A job with id '" + id + "' already exists");
    }
}
