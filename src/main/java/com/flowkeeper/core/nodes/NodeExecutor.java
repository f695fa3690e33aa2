package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Runs the body of one DAG node. Called by the workflow orchestrator inside a
 * retried activity.
 */
public interface NodeExecutor {

    /**
     * @param nodeType the node's type tag
     * @param config   the node's configuration, never null
     * @param context  snapshot of the execution context; implementations must not rely on mutating it
     * @return keys to merge into the execution context
     * @throws NodeExecutionException when the node fails
     */
    ObjectNode execute(String nodeType, ObjectNode config, ObjectNode context);
}
