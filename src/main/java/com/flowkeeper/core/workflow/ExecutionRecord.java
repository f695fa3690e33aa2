package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Externally visible status row of a workflow execution.
 */
public record ExecutionRecord(
    String executionId,
    String workflowId,
    ExecutionStatus status,
    JsonNode inputs,
    JsonNode outputs,
    String error,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {

    ExecutionRecord withStatus(ExecutionStatus next, JsonNode newOutputs, String newError, Instant now) {
        return new ExecutionRecord(executionId, workflowId, next, inputs,
                newOutputs != null ? newOutputs : outputs,
                newError != null ? newError : error,
                createdAt,
                next == ExecutionStatus.RUNNING && startedAt == null ? now : startedAt,
                next.isTerminal() ? now : completedAt);
    }
}
