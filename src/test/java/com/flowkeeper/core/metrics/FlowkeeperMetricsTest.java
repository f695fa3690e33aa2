package com.flowkeeper.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FlowkeeperMetricsTest {

    private SimpleMeterRegistry registry;
    private FlowkeeperMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new FlowkeeperMetrics(registry);
    }

    @Test
    @DisplayName("recordExecutionResult counts by workflow type and status")
    void recordExecutionResult() {
        metrics.recordExecutionResult("dag-orchestrator", "completed");
        metrics.recordExecutionResult("dag-orchestrator", "completed");
        metrics.recordExecutionResult("dag-orchestrator", "failed");

        var completed = registry.find("flowkeeper.executions.total")
                .tag("workflow", "dag-orchestrator").tag("status", "completed").counter();
        var failed = registry.find("flowkeeper.executions.total")
                .tag("workflow", "dag-orchestrator").tag("status", "failed").counter();

        assertNotNull(completed);
        assertNotNull(failed);
        assertEquals(2.0, completed.count());
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("recordReplay records the replayed history size")
    void recordReplay() {
        metrics.recordReplay("agent-orchestrator", 12);

        var summary = registry.find("flowkeeper.replay.events").tag("workflow", "agent-orchestrator").summary();
        assertNotNull(summary);
        assertEquals(12.0, summary.totalAmount());
    }

    @Test
    @DisplayName("activity timers are tagged by outcome")
    void recordActivityDuration() {
        metrics.recordActivityDuration("callLLM", 250, true);
        metrics.recordActivityDuration("callLLM", 50, false);

        var ok = registry.find("flowkeeper.activity.duration").tag("activity", "callLLM").tag("success", "true").timer();
        assertNotNull(ok);
        assertEquals(1, ok.count());
        assertEquals(250.0, ok.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("retries and timeouts are counted per activity")
    void retriesAndTimeouts() {
        metrics.recordActivityRetry("executeNode:a");
        metrics.recordActivityTimeout("executeNodeBatch", "heartbeat");

        assertEquals(1.0, registry.get("flowkeeper.activity.retries").tag("activity", "executeNode:a").counter().count());
        assertEquals(1.0, registry.get("flowkeeper.activity.timeouts")
                .tag("activity", "executeNodeBatch").tag("kind", "heartbeat").counter().count());
    }

    @Test
    @DisplayName("node and agent meters")
    void nodeAndAgent() {
        metrics.recordNodeExecution("echo", 3, true);
        metrics.recordErrorStrategy("fallback");
        metrics.recordAgentIterations(4);
        metrics.recordToolCall("workflow", false);
        metrics.recordCheckpoint("incremental");
        metrics.recordContinuation("agent-orchestrator");

        assertNotNull(registry.find("flowkeeper.node.duration").tag("type", "echo").timer());
        assertEquals(1.0, registry.get("flowkeeper.node.error_strategy").tag("strategy", "fallback").counter().count());
        assertEquals(4.0, registry.get("flowkeeper.agent.iterations").summary().totalAmount());
        assertEquals(1.0, registry.get("flowkeeper.agent.tool_calls")
                .tag("type", "workflow").tag("success", "false").counter().count());
        assertEquals(1.0, registry.get("flowkeeper.agent.checkpoints").tag("reason", "incremental").counter().count());
        assertEquals(1.0, registry.get("flowkeeper.executions.continuations").counter().count());
    }
}
