package com.manifoldplatform.common.exception;

/**
 * Root of the manifold error taxonomy. Unchecked; raised synchronously by the
 * engine on invalid input shape or configuration.
 */
public class ManifoldException extends RuntimeException {
    private final String operation;

    public ManifoldException(String operation, String message) {
        super("[" + operation + "] " + message);
        this.operation = operation;
    }

    public ManifoldException(String operation, String message, Throwable cause) {
        super("[" + operation + "] " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
