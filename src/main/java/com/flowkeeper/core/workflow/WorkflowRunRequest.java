package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Input of a DAG run.
 *
 * @param workflowId id of the stored workflow, used for the execution record
 * @param definition the graph to run
 * @param inputs     initial context; may be null
 */
public record WorkflowRunRequest(String workflowId, WorkflowDefinition definition, ObjectNode inputs) {
}
