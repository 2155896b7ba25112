package com.mcpfactory.orchestrator.packaging;

public class PackagingException extends RuntimeException {

    public PackagingException(String message) {
        super(message);
    }

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
