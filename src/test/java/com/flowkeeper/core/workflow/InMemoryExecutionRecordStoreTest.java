package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryExecutionRecordStoreTest {

    private InMemoryExecutionRecordStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryExecutionRecordStore(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("create is idempotent and starts PENDING")
    void createIdempotent() {
        ExecutionRecord first = store.create("EX-1", "wf", null);
        ExecutionRecord second = store.create("EX-1", "other", null);

        assertSame(first, second);
        assertEquals(ExecutionStatus.PENDING, first.status());
        assertEquals("wf", second.workflowId());
    }

    @Test
    @DisplayName("RUNNING sets startedAt and terminal states set completedAt")
    void timestamps() {
        store.create("EX-1", "wf", null);
        ExecutionRecord running = store.transition("EX-1", ExecutionStatus.RUNNING, null, null);
        assertNotNull(running.startedAt());
        assertNull(running.completedAt());

        ExecutionRecord done = store.transition("EX-1", ExecutionStatus.COMPLETED, TextNode.valueOf("out"), null);
        assertEquals(ExecutionStatus.COMPLETED, done.status());
        assertEquals(TextNode.valueOf("out"), done.outputs());
        assertNotNull(done.completedAt());
    }

    @Test
    @DisplayName("terminal records cannot move to a different status")
    void terminalIsFinal() {
        store.create("EX-1", "wf", null);
        store.transition("EX-1", ExecutionStatus.FAILED, null, "boom");

        assertThrows(IllegalStateException.class,
                () -> store.transition("EX-1", ExecutionStatus.RUNNING, null, null));
        assertEquals("boom", store.transition("EX-1", ExecutionStatus.FAILED, null, null).error());
    }

    @Test
    @DisplayName("transition of a missing record fails")
    void missing() {
        assertThrows(NoSuchElementException.class,
                () -> store.transition("nope", ExecutionStatus.RUNNING, null, null));
    }

    @Test
    @DisplayName("wire names are lower case")
    void wireNames() {
        assertEquals("cancelled", ExecutionStatus.CANCELLED.wireName());
        assertTrue(ExecutionStatus.CANCELLED.isTerminal());
        assertFalse(ExecutionStatus.PENDING.isTerminal());
    }
}
