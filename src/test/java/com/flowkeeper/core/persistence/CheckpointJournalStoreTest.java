package com.flowkeeper.core.persistence;

import com.fasterxml.jackson.databind.node.TextNode;
import com.flowkeeper.core.substrate.HistoryEvent;
import com.flowkeeper.core.substrate.InProcessExecutionHost;
import com.flowkeeper.core.substrate.JournalSnapshot;
import com.flowkeeper.core.substrate.JournalStatus;
import com.flowkeeper.core.substrate.TestWorkflows;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static com.flowkeeper.core.substrate.TestWorkflows.MAPPER;
import static com.flowkeeper.core.substrate.TestWorkflows.crash;
import static com.flowkeeper.core.substrate.TestWorkflows.quick;
import static com.flowkeeper.core.substrate.TestWorkflows.workflow;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Journals stored as checkpoints, on both the in-memory and the JDBC saver.
 */
class CheckpointJournalStoreTest {

    static Stream<BaseCheckpointSaver> savers() throws Exception {
        JdbcCheckpointSaver jdbc = new JdbcCheckpointSaver(H2.dataSource());
        jdbc.createTables();
        return Stream.of(new MemorySaver(), jdbc);
    }

    private static CheckpointJournalStore store(BaseCheckpointSaver saver) {
        return new CheckpointJournalStore(saver, new CheckpointQueryService(saver), MAPPER);
    }

    private static JournalSnapshot snapshot(String executionId, int runId, JournalStatus status) {
        var event = new HistoryEvent(0, HistoryEvent.Kind.ACTIVITY, "executeNode:a",
                MAPPER.createObjectNode().put("greeting", "hi"), null, 1, 10L);
        return new JournalSnapshot(executionId, "dag-orchestrator", runId, status,
                MAPPER.createObjectNode().put("workflowId", "hello"), List.of(event),
                Map.of("userInput", List.of(TextNode.valueOf("yes"))), Map.of("userInput", 0),
                List.of("userInput"), null, null, 5L, 10L);
    }

    @ParameterizedTest
    @MethodSource("savers")
    @DisplayName("a saved journal loads back unchanged")
    void roundTrips(BaseCheckpointSaver saver) {
        CheckpointJournalStore store = store(saver);
        store.save(snapshot("FLOW-1", 1, JournalStatus.RUNNING));

        JournalSnapshot loaded = store.load("FLOW-1").orElseThrow();
        assertEquals("dag-orchestrator", loaded.workflowType());
        assertEquals(JournalStatus.RUNNING, loaded.status());
        assertEquals(HistoryEvent.Kind.ACTIVITY, loaded.history().get(0).kind());
        assertEquals("hi", loaded.history().get(0).value().path("greeting").asText());
        assertEquals(1, loaded.pendingSignalCount());
        assertEquals(List.of("userInput"), loaded.pendingSignals());
        assertEquals("hello", loaded.input().path("workflowId").asText());
        assertTrue(store.load("FLOW-404").isEmpty());
    }

    @ParameterizedTest
    @MethodSource("savers")
    @DisplayName("saving the same run again overwrites its checkpoint")
    void overwritesRun(BaseCheckpointSaver saver) {
        CheckpointJournalStore store = store(saver);
        store.save(snapshot("FLOW-2", 1, JournalStatus.RUNNING));
        store.save(snapshot("FLOW-2", 1, JournalStatus.COMPLETED));

        assertEquals(JournalStatus.COMPLETED, store.load("FLOW-2").orElseThrow().status());
        assertEquals(1, new CheckpointQueryService(saver).listCheckpoints("FLOW-2").size());
    }

    @ParameterizedTest
    @MethodSource("savers")
    @DisplayName("releasing earlier runs keeps the current one")
    void releasesEarlierRuns(BaseCheckpointSaver saver) {
        CheckpointJournalStore store = store(saver);
        store.save(snapshot("FLOW-3", 1, JournalStatus.RUNNING));
        store.save(snapshot("FLOW-3", 2, JournalStatus.RUNNING));
        assertEquals(2, store.load("FLOW-3").orElseThrow().runId());

        store.releaseRunsBefore("FLOW-3", 2);

        var remaining = new CheckpointQueryService(saver).listCheckpoints("FLOW-3");
        assertEquals(1, remaining.size());
        assertEquals("FLOW-3/run-2", remaining.iterator().next().getId());
        assertEquals(2, store.load("FLOW-3").orElseThrow().runId());
        assertEquals(List.of("FLOW-3"), store.listExecutionIds());
    }

    @ParameterizedTest
    @MethodSource("savers")
    @DisplayName("the highest run is loaded even when an older run was written last")
    void loadsHighestRun(BaseCheckpointSaver saver) {
        CheckpointJournalStore store = store(saver);
        store.save(snapshot("FLOW-5", 1, JournalStatus.RUNNING));
        store.save(snapshot("FLOW-5", 2, JournalStatus.RUNNING));
        store.save(snapshot("FLOW-5", 1, JournalStatus.RUNNING));

        assertEquals(2, store.load("FLOW-5").orElseThrow().runId());
    }

    @Test
    @DisplayName("run numbers are read from checkpoint ids")
    void parsesRunNumbers() {
        assertEquals(12, CheckpointJournalStore.runOf(CheckpointJournalStore.checkpointId("FLOW-1", 12)));
        assertEquals(-1, CheckpointJournalStore.runOf("foreign"));
        assertEquals(-1, CheckpointJournalStore.runOf("FLOW-1/run-x"));
        assertEquals(-1, CheckpointJournalStore.runOf(null));
    }

    @Nested
    @DisplayName("Crash and resume")
    class CrashAndResume {

        @Test
        @DisplayName("a new host on the same database resumes without repeating finished activities")
        void resumesAcrossHosts() throws Exception {
            JdbcCheckpointSaver saver = new JdbcCheckpointSaver(H2.dataSource());
            saver.createTables();
            AtomicInteger firstRuns = new AtomicInteger();
            AtomicBoolean crashed = new AtomicBoolean();
            var wf = workflow("two-steps", String.class, String.class, (ctx, in) -> {
                String a = ctx.executeActivity("first", quick(1), String.class, x -> "A" + firstRuns.incrementAndGet());
                if (!crashed.getAndSet(true)) {
                    throw crash();
                }
                return a + ctx.executeActivity("second", quick(1), String.class, x -> "B");
            });

            InProcessExecutionHost first = TestWorkflows.host(store(saver));
            assertThrows(CancellationException.class, () -> first.execute("FLOW-9", wf, "in"));
            first.shutdown();

            InProcessExecutionHost second = TestWorkflows.host(store(saver));
            try {
                assertEquals(List.of("FLOW-9"), second.listExecutionIds());
                assertEquals("A1B", second.resume("FLOW-9", wf));
                assertEquals(1, firstRuns.get());
                assertEquals(JournalStatus.COMPLETED, second.describe("FLOW-9").orElseThrow().status());
            } finally {
                second.shutdown();
            }
        }

        @Test
        @DisplayName("a continuation interrupted before old runs are released resumes from the new run")
        void resumesInterruptedContinuation() throws Exception {
            JdbcCheckpointSaver saver = new JdbcCheckpointSaver(H2.dataSource());
            saver.createTables();
            AtomicBoolean died = new AtomicBoolean();
            CheckpointJournalStore dying = new CheckpointJournalStore(saver, new CheckpointQueryService(saver), MAPPER) {
                @Override
                public synchronized void releaseRunsBefore(String executionId, int runId) {
                    if (died.compareAndSet(false, true)) {
                        throw new IllegalStateException("process died");
                    }
                    super.releaseRunsBefore(executionId, runId);
                }
            };
            var wf = workflow("counter", Integer.class, Integer.class, (ctx, n) -> {
                ctx.executeActivity("tick", quick(1), Integer.class, x -> n);
                if (n < 2) {
                    throw ctx.continueAsNew(n + 1);
                }
                return n * 10;
            });

            InProcessExecutionHost first = TestWorkflows.host(dying);
            assertThrows(IllegalStateException.class, () -> first.execute("FLOW-10", wf, 1));
            first.shutdown();
            assertEquals(2, new CheckpointQueryService(saver).listCheckpoints("FLOW-10").size());

            InProcessExecutionHost second = TestWorkflows.host(store(saver));
            try {
                assertEquals(20, second.resume("FLOW-10", wf));
                JournalSnapshot finished = second.describe("FLOW-10").orElseThrow();
                assertEquals(2, finished.runId());
                assertEquals(JournalStatus.COMPLETED, finished.status());
            } finally {
                second.shutdown();
            }
        }
    }
}
