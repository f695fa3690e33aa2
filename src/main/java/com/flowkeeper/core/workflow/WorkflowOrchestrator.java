package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowkeeper.core.engine.EngineProperties;
import com.flowkeeper.core.events.EventEmitter;
import com.flowkeeper.core.events.EventType;
import com.flowkeeper.core.logging.MdcContext;
import com.flowkeeper.core.metrics.FlowkeeperMetrics;
import com.flowkeeper.core.nodes.NodeExecutor;
import com.flowkeeper.core.substrate.ActivityFailureException;
import com.flowkeeper.core.substrate.ActivityOptions;
import com.flowkeeper.core.substrate.DurableContext;
import com.flowkeeper.core.substrate.DurableWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Durable DAG orchestrator.
 * <p>
 * Nodes are visited depth-first from the start set: a node's dependencies are
 * visited before its body runs, then its dependents (or its goto target). Each
 * node runs at most once per run. A node whose dependency failed is not run
 * and is itself recorded as failed, so a failure marks everything downstream
 * of it. Traversal uses an explicit frame stack, so
 * graph depth is not bounded by the thread stack.
 * <p>
 * Every node body other than {@code input} runs as an activity through the
 * {@link NodeExecutor}; input nodes copy from the run inputs inside the
 * orchestration and never reach the executor.
 */
@Component
public class WorkflowOrchestrator implements DurableWorkflow<WorkflowRunRequest, WorkflowRunResult> {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    public static final String TYPE = "dag-orchestrator";
    static final String DEPENDENCY_FAILED = "Dependency failed";

    private final NodeExecutor nodeExecutor;
    private final EventEmitter events;
    private final ExecutionRecordStore records;
    private final EngineProperties properties;
    private final ObjectMapper objectMapper;
    private final FlowkeeperMetrics metrics;

    public WorkflowOrchestrator(NodeExecutor nodeExecutor, EventEmitter events, ExecutionRecordStore records,
                                EngineProperties properties, ObjectMapper objectMapper, FlowkeeperMetrics metrics) {
        this.nodeExecutor = nodeExecutor;
        this.events = events;
        this.records = records;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Class<WorkflowRunRequest> inputType() {
        return WorkflowRunRequest.class;
    }

    @Override
    public Class<WorkflowRunResult> outputType() {
        return WorkflowRunResult.class;
    }

    @Override
    public WorkflowRunResult run(DurableContext ctx, WorkflowRunRequest request) {
        ObjectNode inputs = request.inputs() != null ? request.inputs() : objectMapper.createObjectNode();
        long startedAt = ctx.currentTime().toEpochMilli();

        ExecutionGraph graph;
        try {
            graph = ExecutionGraph.of(request.definition());
        } catch (WorkflowDefinitionException e) {
            recordStatus(ctx, request, ExecutionStatus.FAILED, null, e.getMessage());
            events.emit(ctx, EventType.EXECUTION_FAILED, payload("error", e.getMessage()));
            throw e;
        }

        recordStatus(ctx, request, ExecutionStatus.RUNNING, null, null);
        String workflowName = request.definition().name();
        log.info("Running workflow '{}' ({} nodes) as {}", workflowName, graph.size(), ctx.executionId());
        events.emit(ctx, EventType.EXECUTION_STARTED,
                payload("workflowId", request.workflowId(), "workflowName", workflowName, "totalNodes", graph.size()));

        Traversal traversal = new Traversal(ctx, graph, inputs);
        for (String start : graph.startNodes()) {
            traversal.visit(start);
        }

        ObjectNode outputs = traversal.context;
        long duration = ctx.currentTime().toEpochMilli() - startedAt;
        if (!traversal.failures.isEmpty()) {
            String error = "Workflow completed with errors: " + toJson(traversal.failures);
            recordStatus(ctx, request, ExecutionStatus.FAILED, outputs, error);
            events.emit(ctx, EventType.EXECUTION_FAILED,
                    payload("error", error, "failedNodeId", traversal.failures.keySet().iterator().next(),
                            "duration", duration));
            log.warn("Workflow '{}' finished with {} failed node(s)", workflowName, traversal.failures.size());
            return new WorkflowRunResult(false, outputs, error, traversal.failures);
        }

        recordStatus(ctx, request, ExecutionStatus.COMPLETED, outputs, null);
        events.emit(ctx, EventType.EXECUTION_COMPLETED, payload("outputs", outputs, "duration", duration));
        log.info("Workflow '{}' completed in {}ms", workflowName, duration);
        return new WorkflowRunResult(true, outputs, null, Map.of());
    }

    private void recordStatus(DurableContext ctx, WorkflowRunRequest request, ExecutionStatus status,
                              JsonNode outputs, String error) {
        String executionId = ctx.executionId();
        ctx.executeActivity("recordStatus:" + status.wireName(), properties.getPersistence().toOptions(),
                Boolean.class, activity -> {
                    records.create(executionId, request.workflowId(), request.inputs());
                    records.transition(executionId, status, outputs, error);
                    return Boolean.TRUE;
                });
    }

    private String toJson(Map<String, String> failures) {
        try {
            return objectMapper.writeValueAsString(failures);
        } catch (JsonProcessingException e) {
            return failures.toString();
        }
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private enum Stage { ENTER, DEPENDENCIES, EXECUTE, DEPENDENTS }

    private static final class Frame {
        final String nodeId;
        Stage stage = Stage.ENTER;
        Iterator<String> next;

        Frame(String nodeId) {
            this.nodeId = nodeId;
        }
    }

    /** Outcome of one node body after its error policy was applied. */
    private enum NodeOutcome { SUCCEEDED, HANDLED, REDIRECTED, FAILED }

    /**
     * State of one DAG run.
     */
    private final class Traversal {

        final DurableContext ctx;
        final ExecutionGraph graph;
        final ObjectNode inputs;
        final ObjectNode context;
        final Set<String> visited = new HashSet<>();
        final Map<String, String> failures = new LinkedHashMap<>();
        final ActivityOptions nodeOptions = properties.getNode().toOptions();
        int completed;

        Traversal(DurableContext ctx, ExecutionGraph graph, ObjectNode inputs) {
            this.ctx = ctx;
            this.graph = graph;
            this.inputs = inputs;
            this.context = inputs.deepCopy();
        }

        void visit(String rootId) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(rootId));
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                switch (frame.stage) {
                    case ENTER -> {
                        if (!visited.add(frame.nodeId)) {
                            stack.pop();
                        } else {
                            frame.next = graph.dependencies(frame.nodeId).iterator();
                            frame.stage = Stage.DEPENDENCIES;
                        }
                    }
                    case DEPENDENCIES -> {
                        if (frame.next.hasNext()) {
                            stack.push(new Frame(frame.next.next()));
                        } else {
                            frame.stage = Stage.EXECUTE;
                        }
                    }
                    case EXECUTE -> {
                        NodeOutcome outcome = execute(frame.nodeId);
                        switch (outcome) {
                            case SUCCEEDED, HANDLED, FAILED -> {
                                frame.next = graph.dependents(frame.nodeId).iterator();
                                frame.stage = Stage.DEPENDENTS;
                            }
                            case REDIRECTED -> {
                                frame.next = List.of(graph.node(frame.nodeId).onError().gotoNode()).iterator();
                                frame.stage = Stage.DEPENDENTS;
                            }
                        }
                    }
                    case DEPENDENTS -> {
                        if (frame.next.hasNext()) {
                            stack.push(new Frame(frame.next.next()));
                        } else {
                            stack.pop();
                        }
                    }
                }
            }
        }

        NodeOutcome execute(String nodeId) {
            WorkflowNode node = graph.node(nodeId);
            for (String dependency : graph.dependencies(nodeId)) {
                if (failures.containsKey(dependency)) {
                    failures.put(nodeId, DEPENDENCY_FAILED);
                    events.emit(ctx, EventType.NODE_FAILED, nodeId,
                            payload("nodeName", node.name(), "nodeType", node.type(), "error", DEPENDENCY_FAILED));
                    log.info("Skipping node {}: dependency {} failed", nodeId, dependency);
                    return NodeOutcome.FAILED;
                }
            }

            events.emit(ctx, EventType.NODE_STARTED, nodeId, payload("nodeName", node.name(), "nodeType", node.type()));
            long nodeStart = ctx.currentTime().toEpochMilli();
            ObjectNode result;
            try {
                result = node.isInput() ? copyInput(node) : runBody(nodeId, node);
            } catch (ActivityFailureException e) {
                long elapsed = ctx.currentTime().toEpochMilli() - nodeStart;
                if (!ctx.isReplaying()) {
                    metrics.recordNodeExecution(node.type(), elapsed, false);
                }
                return applyPolicy(nodeId, node, e.getMessage());
            }

            context.setAll(result);
            completed++;
            long elapsed = ctx.currentTime().toEpochMilli() - nodeStart;
            if (!ctx.isReplaying()) {
                metrics.recordNodeExecution(node.type(), elapsed, true);
            }
            events.emit(ctx, EventType.NODE_COMPLETED, nodeId,
                    payload("nodeName", node.name(), "nodeType", node.type(), "duration", elapsed, "output", result));
            events.emit(ctx, EventType.EXECUTION_PROGRESS, payload(
                    "completedNodes", completed,
                    "totalNodes", graph.size(),
                    "percentage", Math.round(completed * 100.0 / graph.size())));
            return NodeOutcome.SUCCEEDED;
        }

        private ObjectNode copyInput(WorkflowNode node) {
            String inputName = node.config().path("inputName").asText("input");
            JsonNode value = inputs.get(inputName);
            if (value == null) {
                value = node.config().get("defaultValue");
            }
            ObjectNode result = objectMapper.createObjectNode();
            if (value != null) {
                result.set(inputName, value.deepCopy());
            }
            return result;
        }

        private ObjectNode runBody(String nodeId, WorkflowNode node) {
            String executionId = ctx.executionId();
            ObjectNode snapshot = context.deepCopy();
            ObjectNode result = ctx.executeActivity("executeNode:" + nodeId, nodeOptions, ObjectNode.class,
                    activity -> {
                        MdcContext.setNode(executionId, nodeId);
                        try {
                            return nodeExecutor.execute(node.type(), node.config().deepCopy(), snapshot.deepCopy());
                        } finally {
                            MdcContext.clearNode();
                        }
                    });
            return result != null ? result : objectMapper.createObjectNode();
        }

        private NodeOutcome applyPolicy(String nodeId, WorkflowNode node, String error) {
            ErrorPolicy policy = node.onError();
            events.emit(ctx, EventType.NODE_FAILED, nodeId, payload(
                    "nodeName", node.name(), "nodeType", node.type(), "error", error,
                    "strategy", policy.strategy().wireName()));
            if (!ctx.isReplaying()) {
                metrics.recordErrorStrategy(policy.strategy().wireName());
            }
            switch (policy.strategy()) {
                case CONTINUE -> {
                    log.warn("Node {} failed, continuing: {}", nodeId, error);
                    return NodeOutcome.HANDLED;
                }
                case FALLBACK -> {
                    JsonNode fallback = policy.fallbackValue();
                    if (fallback != null && fallback.isObject()) {
                        context.setAll((ObjectNode) fallback.deepCopy());
                    } else if (fallback != null) {
                        context.set(nodeId, fallback.deepCopy());
                    }
                    log.warn("Node {} failed, using fallback: {}", nodeId, error);
                    return NodeOutcome.HANDLED;
                }
                case GOTO -> {
                    log.warn("Node {} failed, jumping to {}: {}", nodeId, policy.gotoNode(), error);
                    return NodeOutcome.REDIRECTED;
                }
                default -> {
                    failures.put(nodeId, error);
                    log.error("Node {} failed: {}", nodeId, error);
                    return NodeOutcome.FAILED;
                }
            }
        }
    }
}
