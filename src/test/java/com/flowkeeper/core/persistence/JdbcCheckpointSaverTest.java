package com.flowkeeper.core.persistence;

import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs {@link JdbcCheckpointSaver} against an in-memory H2 database.
 */
class JdbcCheckpointSaverTest {

    private JdbcCheckpointSaver saver;

    @BeforeEach
    void setUp() throws Exception {
        saver = new JdbcCheckpointSaver(H2.dataSource());
        saver.createTables();
    }

    private static RunnableConfig thread(String threadId) {
        return RunnableConfig.builder().threadId(threadId).build();
    }

    private static Checkpoint checkpoint(String id, String status, Map<String, Object> state) {
        return Checkpoint.builder().id(id).state(state).nodeId("dag-orchestrator").nextNodeId(status).build();
    }

    @Test
    @DisplayName("creating tables twice is harmless")
    void createTablesIsIdempotent() {
        assertDoesNotThrow(() -> saver.createTables());
    }

    @Test
    @DisplayName("stores and reads back a checkpoint with its state")
    void putAndGet() throws Exception {
        RunnableConfig saved = saver.put(thread("FLOW-1"),
                checkpoint("FLOW-1/run-1", "RUNNING", Map.of("runId", 1, "executionId", "FLOW-1")));

        assertEquals(Optional.of("FLOW-1/run-1"), saved.checkPointId());
        Checkpoint loaded = saver.get(thread("FLOW-1")).orElseThrow();
        assertEquals("FLOW-1/run-1", loaded.getId());
        assertEquals("dag-orchestrator", loaded.getNodeId());
        assertEquals("RUNNING", loaded.getNextNodeId());
        assertEquals(1, loaded.getState().get("runId"));
    }

    @Test
    @DisplayName("writing the same checkpoint id again updates the row")
    void putUpdatesInPlace() throws Exception {
        saver.put(thread("FLOW-2"), checkpoint("FLOW-2/run-1", "RUNNING", Map.of("events", 1)));
        saver.put(thread("FLOW-2"), checkpoint("FLOW-2/run-1", "COMPLETED", Map.of("events", 4)));

        Collection<Checkpoint> all = saver.list(thread("FLOW-2"));
        assertEquals(1, all.size());
        Checkpoint only = all.iterator().next();
        assertEquals("COMPLETED", only.getNextNodeId());
        assertEquals(4, only.getState().get("events"));
    }

    @Test
    @DisplayName("reads a specific checkpoint by id")
    void getById() throws Exception {
        saver.put(thread("FLOW-3"), checkpoint("FLOW-3/run-1", "RUNNING", Map.of("n", "a")));

        var config = RunnableConfig.builder().threadId("FLOW-3").checkPointId("FLOW-3/run-1").build();
        assertEquals("a", saver.get(config).orElseThrow().getState().get("n"));

        var missing = RunnableConfig.builder().threadId("FLOW-3").checkPointId("FLOW-3/run-9").build();
        assertTrue(saver.get(missing).isEmpty());
    }

    @Test
    @DisplayName("threads are independent and listed in order")
    void threadsAreIndependent() throws Exception {
        saver.put(thread("FLOW-B"), checkpoint("FLOW-B/run-1", "RUNNING", Map.of()));
        saver.put(thread("FLOW-A"), checkpoint("FLOW-A/run-1", "RUNNING", Map.of()));

        assertEquals(List.of("FLOW-A", "FLOW-B"), saver.listAllThreadIds());
        assertEquals(1, saver.list(thread("FLOW-A")).size());
        assertTrue(saver.list(thread("FLOW-C")).isEmpty());
    }

    @Test
    @DisplayName("release removes every checkpoint of the thread")
    void release() throws Exception {
        saver.put(thread("FLOW-4"), checkpoint("FLOW-4/run-1", "RUNNING", Map.of()));
        saver.put(thread("FLOW-5"), checkpoint("FLOW-5/run-1", "RUNNING", Map.of()));

        BaseCheckpointSaver.Tag tag = saver.release(thread("FLOW-4"));

        assertEquals("FLOW-4", tag.threadId());
        assertEquals(1, tag.checkpoints().size());
        assertTrue(saver.get(thread("FLOW-4")).isEmpty());
        assertEquals(List.of("FLOW-5"), saver.listAllThreadIds());
    }

    @Test
    @DisplayName("deleteCheckpoints removes only the named checkpoints")
    void deleteCheckpoints() throws Exception {
        saver.put(thread("FLOW-6"), checkpoint("FLOW-6/run-1", "RUNNING", Map.of()));
        saver.put(thread("FLOW-6"), checkpoint("FLOW-6/run-2", "RUNNING", Map.of()));
        saver.put(thread("FLOW-6"), checkpoint("FLOW-6/run-3", "RUNNING", Map.of()));

        int deleted = saver.deleteCheckpoints("FLOW-6", List.of("FLOW-6/run-1", "FLOW-6/run-2"));

        assertEquals(2, deleted);
        Collection<Checkpoint> left = saver.list(thread("FLOW-6"));
        assertEquals(List.of("FLOW-6/run-3"), left.stream().map(Checkpoint::getId).toList());
    }
}
