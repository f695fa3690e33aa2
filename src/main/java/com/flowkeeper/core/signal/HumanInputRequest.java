package com.flowkeeper.core.signal;

import java.time.Duration;

/**
 * @param executionId execution the prompt belongs to
 * @param nodeId      node asking for input
 * @param prompt      text shown to the person
 * @param inputType   free-form hint such as "text" or "number"
 * @param timeout     how long to wait; {@code null} means five minutes
 */
public record HumanInputRequest(
    String executionId,
    String nodeId,
    String prompt,
    String inputType,
    Duration timeout
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    public Duration effectiveTimeout() {
        return timeout != null ? timeout : DEFAULT_TIMEOUT;
    }
}
