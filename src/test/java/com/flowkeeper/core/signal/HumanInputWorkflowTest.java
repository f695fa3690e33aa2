package com.flowkeeper.core.signal;

import com.flowkeeper.core.metrics.FlowkeeperMetrics;
import com.flowkeeper.core.substrate.InProcessExecutionHost;
import com.flowkeeper.core.substrate.TestJournalStore;
import com.flowkeeper.core.substrate.TestWorkflows;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HumanInputWorkflowTest {

    private SimpleMeterRegistry registry;
    private HumanInputWorkflow workflow;
    private InProcessExecutionHost host;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        workflow = new HumanInputWorkflow(new FlowkeeperMetrics(registry));
        host = TestWorkflows.host(new TestJournalStore());
    }

    @Test
    @DisplayName("returns the answer delivered through the userInput signal")
    void answered() throws Exception {
        var request = new HumanInputRequest("HI-1", "approve", "Approve the deployment?", "text", Duration.ofSeconds(10));
        CompletableFuture<HumanInputResult> future = host.start("HI-1", workflow, request);

        long deadline = System.currentTimeMillis() + 5_000;
        while (host.describe("HI-1").isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        host.signal("HI-1", HumanInputWorkflow.SIGNAL, "yes");

        HumanInputResult result = future.get(5, TimeUnit.SECONDS);
        assertTrue(result.success());
        assertEquals("yes", result.userResponse());
        assertFalse(result.timedOut());
        assertEquals(1.0, registry.get("flowkeeper.signal.waits").tag("outcome", "received").counter().count());
    }

    @Test
    @DisplayName("reports a timeout with the configured duration")
    void timedOut() {
        var request = new HumanInputRequest("HI-2", "approve", "Approve?", "text", Duration.ofMillis(50));

        HumanInputResult result = host.execute("HI-2", workflow, request);

        assertFalse(result.success());
        assertTrue(result.timedOut());
        assertEquals("User input timed out after 50ms", result.error());
        assertEquals(1.0, registry.get("flowkeeper.signal.waits").tag("outcome", "timed_out").counter().count());
    }

    @Test
    @DisplayName("missing timeout falls back to five minutes")
    void defaultTimeout() {
        var request = new HumanInputRequest("HI-3", "n", "?", "text", null);
        assertEquals(Duration.ofMinutes(5), request.effectiveTimeout());
    }
}
