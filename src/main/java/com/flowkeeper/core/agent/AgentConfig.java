package com.flowkeeper.core.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Everything the ReAct loop needs to know about an agent.
 *
 * @param maxIterations loop bound; zero or less falls back to the engine default
 * @param owner         user allowed to run the agent; null means anyone
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentConfig(
    String id,
    String name,
    String systemPrompt,
    String model,
    String provider,
    String connectionId,
    Double temperature,
    Integer maxTokens,
    int maxIterations,
    List<ToolDefinition> availableTools,
    MemoryConfig memoryConfig,
    String owner
) {

    public AgentConfig {
        availableTools = availableTools != null ? List.copyOf(availableTools) : List.of();
        if (memoryConfig == null) {
            memoryConfig = MemoryConfig.defaults();
        }
        if (systemPrompt == null) {
            systemPrompt = "";
        }
    }
}
