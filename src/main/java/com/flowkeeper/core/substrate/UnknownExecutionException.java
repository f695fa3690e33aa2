package com.flowkeeper.core.substrate;

public class UnknownExecutionException extends RuntimeException {

    public UnknownExecutionException(String executionId) {
        super("No execution found with id " + executionId);
    }
}
