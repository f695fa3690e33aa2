package com.flowkeeper.core.agent;

import java.util.List;

/**
 * Port for persisted agent conversations.
 */
public interface ConversationStore {

    /**
     * Appends messages to the execution's conversation. Messages whose id is
     * already stored are skipped, so repeated calls are harmless.
     *
     * @return number of messages actually written
     */
    int saveMessages(String executionId, List<ConversationMessage> messages);

    /** Stored messages in insertion order. */
    List<ConversationMessage> loadMessages(String executionId);
}
