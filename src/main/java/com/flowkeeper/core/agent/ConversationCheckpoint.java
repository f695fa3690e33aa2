package com.flowkeeper.core.agent;

import java.util.List;
import java.util.Map;

/**
 * Conversation state carried from one agent run to the next across a continuation.
 *
 * @param messages        the conversation, system message first
 * @param savedMessageIds ids already written to the conversation store
 * @param metadata        free-form run metadata
 */
public record ConversationCheckpoint(List<ConversationMessage> messages, List<String> savedMessageIds,
                                     Map<String, Object> metadata) {

    public ConversationCheckpoint {
        messages = messages != null ? List.copyOf(messages) : List.of();
        savedMessageIds = savedMessageIds != null ? List.copyOf(savedMessageIds) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
