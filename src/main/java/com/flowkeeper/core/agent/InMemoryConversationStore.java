package com.flowkeeper.core.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, List<ConversationMessage>> conversations = new ConcurrentHashMap<>();

    @Override
    public int saveMessages(String executionId, List<ConversationMessage> messages) {
        List<ConversationMessage> stored = conversations.computeIfAbsent(executionId, id -> new ArrayList<>());
        synchronized (stored) {
            int written = 0;
            for (ConversationMessage message : messages) {
                boolean known = stored.stream().anyMatch(m -> m.id().equals(message.id()));
                if (!known) {
                    stored.add(message);
                    written++;
                }
            }
            return written;
        }
    }

    @Override
    public List<ConversationMessage> loadMessages(String executionId) {
        List<ConversationMessage> stored = conversations.get(executionId);
        if (stored == null) {
            return List.of();
        }
        synchronized (stored) {
            return List.copyOf(stored);
        }
    }
}
