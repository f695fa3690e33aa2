package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowkeeper.core.logging.MdcContext;
import com.flowkeeper.core.nodes.NodeExecutor;
import com.flowkeeper.core.substrate.ActivityFailureException;
import com.flowkeeper.core.substrate.ActivityOptions;
import com.flowkeeper.core.substrate.DurableContext;
import com.flowkeeper.core.substrate.DurableWorkflow;
import com.flowkeeper.core.substrate.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a list of nodes of a stored workflow in order inside one heartbeating
 * activity. A failing node fails the attempt and the whole batch is retried;
 * once retries are exhausted every requested node is reported as failed.
 */
@Component
public class NodeBatchWorkflow implements DurableWorkflow<NodeBatchRequest, NodeBatchResult> {

    private static final Logger log = LoggerFactory.getLogger(NodeBatchWorkflow.class);

    public static final String TYPE = "node-batch";

    static final ActivityOptions BATCH_OPTIONS = new ActivityOptions(
            Duration.ofMinutes(10),
            Duration.ofSeconds(30),
            new RetryPolicy(5, 2.0, Duration.ofSeconds(1), Duration.ofSeconds(30)));

    private final WorkflowCatalog catalog;
    private final NodeExecutor nodeExecutor;
    private final ObjectMapper objectMapper;
    private final ActivityOptions options;

    public NodeBatchWorkflow(WorkflowCatalog catalog, NodeExecutor nodeExecutor, ObjectMapper objectMapper) {
        this(catalog, nodeExecutor, objectMapper, BATCH_OPTIONS);
    }

    NodeBatchWorkflow(WorkflowCatalog catalog, NodeExecutor nodeExecutor, ObjectMapper objectMapper,
                      ActivityOptions options) {
        this.catalog = catalog;
        this.nodeExecutor = nodeExecutor;
        this.objectMapper = objectMapper;
        this.options = options;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Class<NodeBatchRequest> inputType() {
        return NodeBatchRequest.class;
    }

    @Override
    public Class<NodeBatchResult> outputType() {
        return NodeBatchResult.class;
    }

    @Override
    public NodeBatchResult run(DurableContext ctx, NodeBatchRequest request) {
        String executionId = ctx.executionId();
        try {
            return ctx.executeActivity("executeNodeBatch", options, NodeBatchResult.class, activity -> {
                WorkflowDefinition definition = catalog.require(request.workflowId());
                ObjectNode context = request.inputs() != null ? request.inputs().deepCopy() : objectMapper.createObjectNode();
                List<String> completed = new ArrayList<>();
                for (String nodeId : request.nodeIds()) {
                    WorkflowNode node = definition.nodes().get(nodeId);
                    if (node == null) {
                        throw new WorkflowDefinitionException("Node " + nodeId + " not found in workflow " + request.workflowId());
                    }
                    MdcContext.setNode(executionId, nodeId);
                    try {
                        context.setAll(runNode(node, context));
                    } finally {
                        MdcContext.clearNode();
                    }
                    completed.add(nodeId);
                    activity.heartbeat(Map.of("completedNodes", completed.size(), "lastNode", nodeId));
                }
                return new NodeBatchResult(true, completed, List.of(), null);
            });
        } catch (ActivityFailureException e) {
            log.error("Node batch of workflow {} failed after {} attempt(s): {}",
                    request.workflowId(), e.attempts(), e.getMessage());
            return new NodeBatchResult(false, List.of(), request.nodeIds(), e.getMessage());
        }
    }

    private ObjectNode runNode(WorkflowNode node, ObjectNode context) {
        if (node.isInput()) {
            String inputName = node.config().path("inputName").asText("input");
            JsonNode value = context.has(inputName) ? context.get(inputName) : node.config().get("defaultValue");
            ObjectNode result = objectMapper.createObjectNode();
            if (value != null) {
                result.set(inputName, value.deepCopy());
            }
            return result;
        }
        ObjectNode result = nodeExecutor.execute(node.type(), node.config().deepCopy(), context.deepCopy());
        return result != null ? result : objectMapper.createObjectNode();
    }
}
