package com.flowkeeper.core.agent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Input of an agent run. A fresh run carries only the ids and the optional
 * initial message; a continuation also carries the checkpoint, the iteration
 * count reached so far and the config loaded by the first run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentRunRequest(
    String agentId,
    String userId,
    String initialMessage,
    ConversationCheckpoint checkpoint,
    int iterations,
    AgentConfig config
) {

    public static AgentRunRequest fresh(String agentId, String userId, String initialMessage) {
        return new AgentRunRequest(agentId, userId, initialMessage, null, 0, null);
    }

    public AgentRunRequest continuation(ConversationCheckpoint next, int iteration, AgentConfig loaded) {
        return new AgentRunRequest(agentId, userId, null, next, iteration, loaded);
    }

    @JsonIgnore
    public boolean isContinuation() {
        return checkpoint != null;
    }
}
