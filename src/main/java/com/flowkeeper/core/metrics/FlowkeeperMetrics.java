package com.flowkeeper.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Flowkeeper executions.
 */
@Service
public class FlowkeeperMetrics {

    private final MeterRegistry registry;

    public FlowkeeperMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecutionResult(String workflowType, String status) {
        Counter.builder("flowkeeper.executions.total")
                .tag("workflow", workflowType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordContinuation(String workflowType) {
        Counter.builder("flowkeeper.executions.continuations")
                .description("Runs ended with continue-as-new")
                .tag("workflow", workflowType)
                .register(registry)
                .increment();
    }

    public void recordReplay(String workflowType, int events) {
        DistributionSummary.builder("flowkeeper.replay.events")
                .description("History events replayed when an execution is resumed")
                .tag("workflow", workflowType)
                .register(registry)
                .record(events);
    }

    // --- Activities ---

    public void recordActivityDuration(String activity, long ms, boolean success) {
        Timer.builder("flowkeeper.activity.duration")
                .tag("activity", activity)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts a failed attempt that will be retried.
     *
     * @param activity activity name, e.g. {@code executeNode}
     */
    public void recordActivityRetry(String activity) {
        Counter.builder("flowkeeper.activity.retries")
                .tag("activity", activity)
                .register(registry)
                .increment();
    }

    public void recordActivityTimeout(String activity, String kind) {
        Counter.builder("flowkeeper.activity.timeouts")
                .tag("activity", activity)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    // --- DAG orchestration ---

    public void recordNodeExecution(String nodeType, long ms, boolean success) {
        Timer.builder("flowkeeper.node.duration")
                .tag("type", nodeType)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordErrorStrategy(String strategy) {
        Counter.builder("flowkeeper.node.error_strategy")
                .description("onError strategies applied after node failures")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    // --- Agent loop ---

    public void recordAgentIterations(int iterations) {
        DistributionSummary.builder("flowkeeper.agent.iterations")
                .register(registry)
                .record(iterations);
    }

    public void recordToolCall(String toolType, boolean success) {
        Counter.builder("flowkeeper.agent.tool_calls")
                .tag("type", toolType)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordCheckpoint(String reason) {
        Counter.builder("flowkeeper.agent.checkpoints")
                .description("Conversation checkpoints written")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSignalWait(String signal, boolean received) {
        Counter.builder("flowkeeper.signal.waits")
                .tag("signal", signal)
                .tag("outcome", received ? "received" : "timed_out")
                .register(registry)
                .increment();
    }
}
