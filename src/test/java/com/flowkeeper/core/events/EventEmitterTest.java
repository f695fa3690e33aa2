package com.flowkeeper.core.events;

import com.flowkeeper.core.substrate.HistoryEvent;
import com.flowkeeper.core.substrate.InProcessExecutionHost;
import com.flowkeeper.core.substrate.TestJournalStore;
import com.flowkeeper.core.substrate.TestWorkflows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.flowkeeper.core.substrate.TestWorkflows.crash;
import static com.flowkeeper.core.substrate.TestWorkflows.workflow;
import static org.junit.jupiter.api.Assertions.*;

class EventEmitterTest {

    private InProcessExecutionHost host;

    @BeforeEach
    void setUp() {
        host = TestWorkflows.host(new TestJournalStore());
    }

    @AfterEach
    void tearDown() {
        host.shutdown();
    }

    @Test
    @DisplayName("each emission is journaled as an emit activity")
    void journalsEmission() {
        List<FlowEvent> received = new CopyOnWriteArrayList<>();
        EventEmitter emitter = new EventEmitter(received::add);
        var wf = workflow("emitting", String.class, String.class, (ctx, in) -> {
            emitter.emit(ctx, EventType.NODE_STARTED, "greet", Map.of("nodeType", "echo"));
            return "done";
        });

        host.execute("EV-1", wf, "x");

        assertEquals(1, received.size());
        FlowEvent event = received.get(0);
        assertEquals("node.started", event.eventType());
        assertEquals("EV-1", event.executionId());
        assertEquals("greet", event.nodeId());
        assertEquals("echo", event.payload().get("nodeType"));
        HistoryEvent recorded = host.describe("EV-1").orElseThrow().history().get(0);
        assertEquals("emit:node.started", recorded.name());
    }

    @Test
    @DisplayName("a failing sink does not fail the orchestration")
    void failingSinkIsDropped() {
        EventEmitter emitter = new EventEmitter(event -> {
            throw new IllegalStateException("sink down");
        });
        var wf = workflow("emitting", String.class, String.class, (ctx, in) -> {
            emitter.emit(ctx, EventType.EXECUTION_STARTED, Map.of());
            return "still ran";
        });

        assertEquals("still ran", host.execute("EV-2", wf, "x"));
    }

    @Test
    @DisplayName("events emitted before a crash are not emitted again on resume")
    void notReemittedOnReplay() {
        List<FlowEvent> received = new CopyOnWriteArrayList<>();
        EventEmitter emitter = new EventEmitter(received::add);
        AtomicBoolean crashed = new AtomicBoolean();
        var wf = workflow("emitting", String.class, String.class, (ctx, in) -> {
            emitter.emit(ctx, EventType.EXECUTION_STARTED, Map.of());
            if (!crashed.getAndSet(true)) {
                throw crash();
            }
            emitter.emit(ctx, EventType.EXECUTION_COMPLETED, Map.of());
            return "ok";
        });

        assertThrows(CancellationException.class, () -> host.execute("EV-3", wf, "x"));
        assertEquals("ok", host.resume("EV-3", wf));

        assertEquals(List.of("execution.started", "execution.completed"),
                received.stream().map(FlowEvent::eventType).toList());
    }
}
