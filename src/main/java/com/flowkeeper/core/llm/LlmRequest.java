package com.flowkeeper.core.llm;

import com.flowkeeper.core.agent.ConversationMessage;
import com.flowkeeper.core.agent.ToolDefinition;

import java.util.List;

/**
 * One chat-completion call: the whole conversation so far plus the tools the model may request.
 */
public record LlmRequest(
    String model,
    String provider,
    String connectionId,
    List<ConversationMessage> messages,
    List<ToolDefinition> tools,
    Double temperature,
    Integer maxTokens
) {

    public LlmRequest {
        messages = messages != null ? List.copyOf(messages) : List.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
    }
}
