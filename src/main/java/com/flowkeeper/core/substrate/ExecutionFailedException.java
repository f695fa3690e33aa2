package com.flowkeeper.core.substrate;

/**
 * Raised when an execution id is re-executed after its journal was closed as failed.
 */
public class ExecutionFailedException extends RuntimeException {

    private final String executionId;

    public ExecutionFailedException(String executionId, String failure) {
        super("Execution " + executionId + " failed: " + failure);
        this.executionId = executionId;
    }

    public String executionId() {
        return executionId;
    }
}
