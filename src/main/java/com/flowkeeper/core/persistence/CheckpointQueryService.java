package com.flowkeeper.core.persistence;

import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Query operations over the checkpoint store that {@link BaseCheckpointSaver}
 * itself lacks: listing every thread (execution) and reading the checkpoints
 * of one thread.
 */
@Service
public class CheckpointQueryService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointQueryService.class);

    private final BaseCheckpointSaver saver;

    public CheckpointQueryService(BaseCheckpointSaver saver) {
        this.saver = saver;
    }

    /**
     * Returns all known thread ids (execution ids).
     * For {@link JdbcCheckpointSaver}, queries the database directly.
     * For {@link MemorySaver}, reflects into the internal map.
     */
    public List<String> listAllThreadIds() {
        if (saver instanceof JdbcCheckpointSaver jdbc) {
            return jdbc.listAllThreadIds();
        }
        if (saver instanceof MemorySaver mem) {
            try {
                var field = MemorySaver.class.getDeclaredField("_checkpointsByThread");
                field.setAccessible(true);
                @SuppressWarnings("unchecked")
                var map = (Map<String, ? extends Collection<?>>) field.get(mem);
                List<String> ids = new ArrayList<>();
                map.forEach((threadId, checkpoints) -> {
                    if (!checkpoints.isEmpty()) {
                        ids.add(threadId);
                    }
                });
                Collections.sort(ids);
                return ids;
            } catch (ReflectiveOperationException | RuntimeException e) {
                log.warn("Unable to list thread ids from MemorySaver", e);
                return List.of();
            }
        }
        return List.of();
    }

    public Collection<Checkpoint> listCheckpoints(String executionId) {
        var config = RunnableConfig.builder().threadId(executionId).build();
        return saver.list(config);
    }
}
