package com.flowkeeper.core.agent;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Port for running one tool call on behalf of an agent.
 */
public interface ToolExecutor {

    /**
     * @return the tool result, serialized into the tool message
     * @throws ToolExecutionException if the tool is unknown or fails
     */
    JsonNode execute(String executionId, ToolCall toolCall, List<ToolDefinition> availableTools,
                     String userId, String agentId);
}
