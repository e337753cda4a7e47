package com.aicli.isolation.runtime;

/**
 * A container runtime call made on behalf of a workspace failed.
 */
public class RuntimeOperationException extends RuntimeException {

    private final String operation;
    private final String target;

    public RuntimeOperationException(String operation, String target, String message) {
        super(operation + " failed for " + target + ": " + message);
        this.operation = operation;
        this.target = target;
    }

    public RuntimeOperationException(String operation, String target, Throwable cause) {
        super(operation + " failed for " + target + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.target = target;
    }

    public String getOperation() {
        return operation;
    }

    /** Workspace ID or network name the operation was aimed at. */
    public String getTarget() {
        return target;
    }
}
