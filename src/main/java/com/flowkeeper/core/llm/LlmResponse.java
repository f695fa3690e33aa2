package com.flowkeeper.core.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flowkeeper.core.agent.ToolCall;

import java.util.List;

/**
 * @param requiresUserInput set when the model asks the user something and the
 *                          loop should wait for a {@code userMessage} signal
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmResponse(String content, List<ToolCall> toolCalls, boolean requiresUserInput) {

    public LlmResponse {
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public static LlmResponse text(String content) {
        return new LlmResponse(content, List.of(), false);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
