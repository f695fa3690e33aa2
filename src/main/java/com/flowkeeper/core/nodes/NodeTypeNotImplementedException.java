package com.flowkeeper.core.nodes;

import com.flowkeeper.core.substrate.NonRetryable;

/**
 * No handler serves the requested node type. Retrying cannot help.
 */
public class NodeTypeNotImplementedException extends NodeExecutionException implements NonRetryable {

    public NodeTypeNotImplementedException(String nodeType) {
        super("Node type '" + nodeType + "' not yet implemented");
    }

    protected NodeTypeNotImplementedException(String nodeType, String message) {
        super(message);
    }

    static NodeTypeNotImplementedException orchestratorOnly(String nodeType) {
        return new NodeTypeNotImplementedException(nodeType,
                nodeType + " nodes must be handled by the workflow orchestrator");
    }
}
