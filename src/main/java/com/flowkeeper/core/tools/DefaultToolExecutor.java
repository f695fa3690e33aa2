package com.flowkeeper.core.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowkeeper.core.agent.ToolCall;
import com.flowkeeper.core.agent.ToolDefinition;
import com.flowkeeper.core.agent.ToolExecutionException;
import com.flowkeeper.core.agent.ToolExecutor;
import com.flowkeeper.core.substrate.DurableExecutionHost;
import com.flowkeeper.core.workflow.WorkflowCatalog;
import com.flowkeeper.core.workflow.WorkflowDefinition;
import com.flowkeeper.core.workflow.WorkflowOrchestrator;
import com.flowkeeper.core.workflow.WorkflowRunRequest;
import com.flowkeeper.core.workflow.WorkflowRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs agent tool calls. {@code workflow} tools start a child DAG execution
 * whose id is derived from the tool call, so a retried call finds the child
 * already finished instead of running it twice. {@code function} tools run
 * in-process through {@link BuiltinFunctions}.
 */
@Service
public class DefaultToolExecutor implements ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolExecutor.class);

    private final DurableExecutionHost host;
    private final WorkflowOrchestrator workflowOrchestrator;
    private final WorkflowCatalog catalog;
    private final BuiltinFunctions functions;
    private final ObjectMapper objectMapper;

    public DefaultToolExecutor(DurableExecutionHost host, WorkflowOrchestrator workflowOrchestrator,
                               WorkflowCatalog catalog, BuiltinFunctions functions, ObjectMapper objectMapper) {
        this.host = host;
        this.workflowOrchestrator = workflowOrchestrator;
        this.catalog = catalog;
        this.functions = functions;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode execute(String executionId, ToolCall toolCall, List<ToolDefinition> availableTools,
                            String userId, String agentId) {
        ToolDefinition tool = availableTools.stream()
                .filter(t -> toolCall.name().equals(t.name()))
                .findFirst()
                .orElseThrow(() -> new ToolExecutionException("Tool \"" + toolCall.name() + "\" not found in available tools"));

        log.info("Agent {} calling {} tool '{}'", agentId, tool.type(), tool.name());
        String type = tool.type() != null ? tool.type() : "";
        return switch (type) {
            case "workflow" -> runWorkflow(executionId, toolCall, tool);
            case "function" -> functions.invoke(tool.config().path("functionName").asText(null), toolCall.arguments());
            default -> throw new ToolExecutionException("Unknown tool type: " + tool.type());
        };
    }

    /** Child execution id for a workflow tool call. */
    public static String childExecutionId(String executionId, String toolCallId) {
        return executionId + "-tool-" + toolCallId;
    }

    private JsonNode runWorkflow(String executionId, ToolCall toolCall, ToolDefinition tool) {
        String workflowId = tool.config().path("workflowId").asText(null);
        if (workflowId == null || workflowId.isBlank()) {
            throw new ToolExecutionException("Workflow tool missing workflowId in config");
        }
        WorkflowDefinition definition = catalog.find(workflowId)
                .orElseThrow(() -> new ToolExecutionException("Workflow " + workflowId + " not found"));

        String childId = childExecutionId(executionId, toolCall.id());
        WorkflowRunResult result;
        try {
            result = host.execute(childId, workflowOrchestrator,
                    new WorkflowRunRequest(workflowId, definition, toolCall.arguments().deepCopy()));
        } catch (RuntimeException e) {
            throw new ToolExecutionException("Workflow execution failed: " + e.getMessage(), e);
        }

        ObjectNode response = objectMapper.createObjectNode();
        response.put("success", result.success());
        response.put("workflowId", workflowId);
        response.put("workflowName", definition.name());
        response.put("executionId", childId);
        response.set("outputs", result.outputs());
        if (result.error() != null) {
            response.put("error", result.error());
        }
        return response;
    }
}
