package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * A list of nodes of a stored workflow to run in order inside one long-running activity.
 */
public record NodeBatchRequest(String workflowId, List<String> nodeIds, ObjectNode inputs) {

    public NodeBatchRequest {
        nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
    }
}
