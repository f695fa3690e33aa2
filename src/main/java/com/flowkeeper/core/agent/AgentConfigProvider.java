package com.flowkeeper.core.agent;

/**
 * Port for agent configuration.
 */
public interface AgentConfigProvider {

    /**
     * @throws AgentConfigException if the agent does not exist or {@code userId} may not run it
     */
    AgentConfig get(String agentId, String userId);
}
