package com.flowkeeper.core.agent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The live conversation of one agent run plus the ids already persisted.
 * Owned by a single orchestration thread.
 */
public final class ConversationWindow {

    private final List<ConversationMessage> messages;
    private final Set<String> savedIds;
    private final Map<String, Object> metadata;

    private ConversationWindow(List<ConversationMessage> messages, Set<String> savedIds, Map<String, Object> metadata) {
        this.messages = messages;
        this.savedIds = savedIds;
        this.metadata = metadata;
    }

    public static ConversationWindow empty() {
        return new ConversationWindow(new ArrayList<>(), new LinkedHashSet<>(), new HashMap<>());
    }

    public static ConversationWindow from(ConversationCheckpoint checkpoint) {
        return new ConversationWindow(new ArrayList<>(checkpoint.messages()),
                new LinkedHashSet<>(checkpoint.savedMessageIds()), new HashMap<>(checkpoint.metadata()));
    }

    public void append(ConversationMessage message) {
        messages.add(message);
    }

    /** Appends a message that needs no persisting, such as the system prompt. */
    public void appendSaved(ConversationMessage message) {
        messages.add(message);
        savedIds.add(message.id());
    }

    public List<ConversationMessage> messages() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }

    public List<ConversationMessage> unsaved() {
        return messages.stream().filter(m -> !savedIds.contains(m.id())).toList();
    }

    public void markSaved(List<ConversationMessage> saved) {
        saved.forEach(m -> savedIds.add(m.id()));
    }

    public ConversationCheckpoint checkpoint() {
        return new ConversationCheckpoint(messages, List.copyOf(savedIds), metadata);
    }

    /**
     * Keeps the system message followed by the most recent {@code maxMessages - 1}
     * entries. Saved ids are filtered to the survivors.
     */
    public ConversationCheckpoint summarize(int maxMessages) {
        if (messages.size() <= maxMessages) {
            return checkpoint();
        }
        ConversationMessage system = messages.stream()
                .filter(m -> m.role() == MessageRole.SYSTEM)
                .findFirst()
                .orElse(null);
        int tail = Math.max(maxMessages - 1, 0);
        List<ConversationMessage> recent = messages.subList(messages.size() - tail, messages.size());

        List<ConversationMessage> kept = new ArrayList<>();
        if (system != null) {
            kept.add(system);
            recent.stream().filter(m -> !m.id().equals(system.id())).forEach(kept::add);
        } else {
            kept.addAll(recent);
        }
        Set<String> keptIds = new LinkedHashSet<>();
        kept.forEach(m -> keptIds.add(m.id()));
        List<String> survivingSaved = savedIds.stream().filter(keptIds::contains).toList();
        return new ConversationCheckpoint(kept, survivingSaved, metadata);
    }
}
