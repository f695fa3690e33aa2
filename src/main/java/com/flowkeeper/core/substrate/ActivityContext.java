package com.flowkeeper.core.substrate;

/**
 * Handle passed to a running activity attempt.
 */
public interface ActivityContext {

    String executionId();

    String activityName();

    /** 1-based attempt number. */
    int attempt();

    /**
     * Liveness marker. Activities started with a heartbeat timeout must call this
     * more often than the timeout or the attempt is abandoned and retried.
     *
     * @param details optional progress information, logged at debug level
     */
    void heartbeat(Object details);
}
