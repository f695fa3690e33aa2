package com.flowkeeper.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Flowkeeper-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExecution(String executionId, int runId) {
        MDC.put("executionId", executionId);
        MDC.put("runId", String.valueOf(runId));
    }

    public static void setNode(String executionId, String nodeId) {
        MDC.put("executionId", executionId);
        MDC.put("nodeId", nodeId);
    }

    public static void setAgent(String executionId, String agentId) {
        MDC.put("executionId", executionId);
        MDC.put("agentId", agentId);
    }

    public static void clearNode() {
        MDC.remove("nodeId");
    }

    public static void clear() {
        MDC.remove("executionId");
        MDC.remove("runId");
        MDC.remove("nodeId");
        MDC.remove("agentId");
    }
}
