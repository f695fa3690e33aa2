package com.flowkeeper.core.substrate;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeouts and retry policy for one activity invocation.
 *
 * @param startToCloseTimeout maximum duration of a single attempt
 * @param heartbeatTimeout    maximum gap between heartbeats; {@code null} disables heartbeat checking
 * @param retryPolicy         retry schedule across attempts
 */
public record ActivityOptions(
    Duration startToCloseTimeout,
    Duration heartbeatTimeout,
    RetryPolicy retryPolicy
) {

    /** Event emission: five seconds, one attempt, never retried. */
    public static final ActivityOptions EVENT_EMISSION =
            new ActivityOptions(Duration.ofSeconds(5), null, RetryPolicy.noRetry());

    public ActivityOptions {
        Objects.requireNonNull(startToCloseTimeout, "startToCloseTimeout");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    public static ActivityOptions of(Duration startToCloseTimeout, RetryPolicy retryPolicy) {
        return new ActivityOptions(startToCloseTimeout, null, retryPolicy);
    }

    public ActivityOptions withHeartbeatTimeout(Duration heartbeatTimeout) {
        return new ActivityOptions(startToCloseTimeout, heartbeatTimeout, retryPolicy);
    }
}
