package com.flowkeeper.core.signal;

import com.flowkeeper.core.substrate.InProcessExecutionHost;
import com.flowkeeper.core.substrate.TestJournalStore;
import com.flowkeeper.core.substrate.TestWorkflows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.flowkeeper.core.substrate.TestWorkflows.workflow;
import static org.junit.jupiter.api.Assertions.*;

class SignalWaitTest {

    private InProcessExecutionHost host;

    @BeforeEach
    void setUp() {
        host = TestWorkflows.host(new TestJournalStore());
    }

    @Test
    @DisplayName("receives a value delivered before the wait starts")
    void receivesEarlyDelivery() throws Exception {
        var wf = workflow("early", String.class, String.class, (ctx, in) -> {
            ctx.await(Duration.ofSeconds(5), ctx.signalChannel("answer", String.class)::hasPending);
            SignalWait<String> wait = SignalWait.on(ctx, "answer", String.class);
            assertTrue(wait.hasReceived());
            WaitResult<String> result = wait.await(Duration.ofSeconds(1));
            assertEquals(SignalWait.State.RECEIVED, wait.state());
            return result.value();
        });

        CompletableFuture<String> future = host.start("SW-1", wf, "in");
        signalWhenOpen("SW-1", "answer", "42");
        assertEquals("42", future.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("times out when nothing arrives and stays timed out")
    void timesOut() {
        var wf = workflow("late", String.class, String.class, (ctx, in) -> {
            SignalWait<String> wait = SignalWait.on(ctx, "answer", String.class);
            WaitResult<String> first = wait.await(Duration.ofMillis(50));
            WaitResult<String> second = wait.await(Duration.ofSeconds(30));
            assertTrue(first.timedOut());
            assertNull(first.value());
            assertTrue(second.timedOut());
            assertFalse(wait.hasReceived());
            return wait.state().name();
        });

        assertEquals("TIMED_OUT", host.execute("SW-2", wf, "in"));
    }

    @Test
    @DisplayName("latest of several pending deliveries wins")
    void latestWins() throws Exception {
        List<String> seen = new ArrayList<>();
        var wf = workflow("latest", String.class, String.class, (ctx, in) -> {
            var channel = ctx.signalChannel("answer", String.class);
            ctx.await(Duration.ofSeconds(5), () -> channel.peek().filter("third"::equals).isPresent());
            WaitResult<String> result = SignalWait.on(ctx, "answer", String.class).await(Duration.ofSeconds(1));
            seen.add(result.value());
            boolean more = SignalWait.on(ctx, "answer", String.class).await(Duration.ofMillis(50)).received();
            return result.value() + (more ? "+more" : "");
        });

        CompletableFuture<String> future = host.start("SW-3", wf, "in");
        signalWhenOpen("SW-3", "answer", "first");
        host.signal("SW-3", "answer", "second");
        host.signal("SW-3", "answer", "third");

        assertEquals("third", future.get(5, TimeUnit.SECONDS));
        assertEquals(List.of("third"), seen);
    }

    @Test
    @DisplayName("result factories set exactly one outcome")
    void resultFactories() {
        WaitResult<String> received = WaitResult.received("ok");
        WaitResult<String> timeout = WaitResult.timeout();

        assertTrue(received.received());
        assertFalse(received.timedOut());
        assertEquals("ok", received.value());
        assertFalse(timeout.received());
        assertTrue(timeout.timedOut());
        assertNull(timeout.value());
    }

    private void signalWhenOpen(String executionId, String name, String payload) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (host.describe(executionId).isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        host.signal(executionId, name, payload);
    }
}
