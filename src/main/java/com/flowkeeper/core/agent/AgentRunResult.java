package com.flowkeeper.core.agent;

import java.util.List;

public record AgentRunResult(
    boolean success,
    String finalMessage,
    int iterations,
    String error,
    List<ConversationMessage> conversation
) {

    public AgentRunResult {
        conversation = conversation != null ? List.copyOf(conversation) : List.of();
    }

    static AgentRunResult completed(String finalMessage, int iterations, List<ConversationMessage> conversation) {
        return new AgentRunResult(true, finalMessage, iterations, null, conversation);
    }

    static AgentRunResult failed(String error, int iterations, List<ConversationMessage> conversation) {
        return new AgentRunResult(false, null, iterations, error, conversation);
    }
}
