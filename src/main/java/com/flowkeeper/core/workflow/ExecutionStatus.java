package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
