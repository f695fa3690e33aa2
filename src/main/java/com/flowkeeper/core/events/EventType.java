package com.flowkeeper.core.events;

public enum EventType {

    EXECUTION_STARTED("execution.started"),
    EXECUTION_PROGRESS("execution.progress"),
    EXECUTION_COMPLETED("execution.completed"),
    EXECUTION_FAILED("execution.failed"),
    NODE_STARTED("node.started"),
    NODE_COMPLETED("node.completed"),
    NODE_FAILED("node.failed"),

    AGENT_STARTED("agent.started"),
    AGENT_THINKING("agent.thinking"),
    AGENT_MESSAGE("agent.message"),
    AGENT_TOOL_CALL_STARTED("agent.tool_call.started"),
    AGENT_TOOL_CALL_COMPLETED("agent.tool_call.completed"),
    AGENT_TOOL_CALL_FAILED("agent.tool_call.failed"),
    AGENT_COMPLETED("agent.completed"),
    AGENT_FAILED("agent.failed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
