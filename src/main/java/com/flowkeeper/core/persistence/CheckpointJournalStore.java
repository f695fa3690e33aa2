package com.flowkeeper.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowkeeper.core.substrate.JournalSnapshot;
import com.flowkeeper.core.substrate.JournalStore;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * {@link JournalStore} on top of a LangGraph4j {@link BaseCheckpointSaver}.
 * <p>
 * Thread id is the execution id; every run is one checkpoint with id
 * {@code <executionId>/run-<runId>}, rewritten in place as events are appended.
 * The checkpoint's node id carries the workflow type and its next node id the
 * journal status, so stores can be browsed without decoding state.
 * <p>
 * A continuation saves the new run before older runs are released, so for a
 * moment a thread may hold two runs; {@link #load} reads the highest one.
 */
@Service
public class CheckpointJournalStore implements JournalStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointJournalStore.class);

    private static final String RUN_MARKER = "/run-";

    private final BaseCheckpointSaver saver;
    private final CheckpointQueryService queryService;
    private final ObjectMapper objectMapper;

    /** Executions saved through this store; covers savers that cannot enumerate threads. */
    private final Set<String> knownIds = new ConcurrentSkipListSet<>();

    public CheckpointJournalStore(BaseCheckpointSaver saver, CheckpointQueryService queryService,
                                  ObjectMapper objectMapper) {
        this.saver = saver;
        this.queryService = queryService;
        this.objectMapper = objectMapper;
    }

    static String checkpointId(String executionId, int runId) {
        return executionId + RUN_MARKER + runId;
    }

    /** Run number encoded in a checkpoint id, or -1 for foreign checkpoints. */
    static int runOf(String checkpointId) {
        int at = checkpointId != null ? checkpointId.lastIndexOf(RUN_MARKER) : -1;
        if (at < 0) {
            return -1;
        }
        try {
            return Integer.parseInt(checkpointId.substring(at + RUN_MARKER.length()));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public synchronized void save(JournalSnapshot snapshot) {
        String executionId = snapshot.executionId();
        String checkpointId = checkpointId(executionId, snapshot.runId());
        var threadConfig = RunnableConfig.builder().threadId(executionId).build();
        boolean exists = saver.list(threadConfig).stream()
                .anyMatch(cp -> checkpointId.equals(cp.getId()));
        var config = exists
                ? RunnableConfig.builder().threadId(executionId).checkPointId(checkpointId).build()
                : threadConfig;

        Map<String, Object> state = objectMapper.convertValue(snapshot, new TypeReference<>() {});
        Checkpoint checkpoint = Checkpoint.builder()
                .id(checkpointId)
                .state(state)
                .nodeId(snapshot.workflowType())
                .nextNodeId(snapshot.status().name())
                .build();
        try {
            saver.put(config, checkpoint);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to save journal of " + executionId, e);
        }
        knownIds.add(executionId);
    }

    @Override
    public Optional<JournalSnapshot> load(String executionId) {
        return queryService.listCheckpoints(executionId).stream()
                .max(Comparator.comparingInt(cp -> runOf(cp.getId())))
                .map(cp -> objectMapper.convertValue(cp.getState(), JournalSnapshot.class));
    }

    @Override
    public synchronized void releaseRunsBefore(String executionId, int runId) {
        List<Checkpoint> checkpoints = new ArrayList<>(queryService.listCheckpoints(executionId));
        List<String> stale = checkpoints.stream()
                .map(Checkpoint::getId)
                .filter(id -> runOf(id) < runId)
                .toList();
        if (stale.isEmpty()) {
            return;
        }
        try {
            if (saver instanceof JdbcCheckpointSaver jdbc) {
                jdbc.deleteCheckpoints(executionId, stale);
            } else {
                // No per-checkpoint delete on the saver: release the thread and put back the runs kept.
                var threadConfig = RunnableConfig.builder().threadId(executionId).build();
                saver.release(threadConfig);
                for (Checkpoint kept : checkpoints) {
                    if (!stale.contains(kept.getId())) {
                        saver.put(threadConfig, kept);
                    }
                }
            }
            log.debug("Released {} stored run(s) of {} before run {}", stale.size(), executionId, runId);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to release old runs of " + executionId, e);
        }
    }

    @Override
    public List<String> listExecutionIds() {
        Set<String> ids = new TreeSet<>(queryService.listAllThreadIds());
        ids.addAll(knownIds);
        ids.removeIf(id -> load(id).isEmpty());
        return List.copyOf(ids);
    }
}
