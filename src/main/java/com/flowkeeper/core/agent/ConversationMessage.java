package com.flowkeeper.core.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One entry of an agent conversation.
 *
 * @param toolCalls  calls requested by an assistant message, empty otherwise
 * @param toolName   tool that produced a tool message
 * @param toolCallId call a tool message answers
 * @param timestamp  epoch millis
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationMessage(
    String id,
    MessageRole role,
    String content,
    List<ToolCall> toolCalls,
    String toolName,
    String toolCallId,
    long timestamp
) {

    public ConversationMessage {
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public static ConversationMessage system(String id, String content, long timestamp) {
        return new ConversationMessage(id, MessageRole.SYSTEM, content, null, null, null, timestamp);
    }

    public static ConversationMessage user(String id, String content, long timestamp) {
        return new ConversationMessage(id, MessageRole.USER, content, null, null, null, timestamp);
    }

    public static ConversationMessage assistant(String id, String content, List<ToolCall> toolCalls, long timestamp) {
        return new ConversationMessage(id, MessageRole.ASSISTANT, content, toolCalls, null, null, timestamp);
    }

    public static ConversationMessage tool(String id, String content, ToolCall call, long timestamp) {
        return new ConversationMessage(id, MessageRole.TOOL, content, null, call.name(), call.id(), timestamp);
    }
}
