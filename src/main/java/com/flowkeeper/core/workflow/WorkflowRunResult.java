package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Outcome of a DAG run.
 *
 * @param success     true when no node failed without a handling policy
 * @param outputs     the final execution context
 * @param error       summary of failed nodes, null on success
 * @param failedNodes node id to error message, in failure order
 */
public record WorkflowRunResult(boolean success, ObjectNode outputs, String error, Map<String, String> failedNodes) {

    public WorkflowRunResult {
        failedNodes = failedNodes != null ? Map.copyOf(failedNodes) : Map.of();
    }
}
