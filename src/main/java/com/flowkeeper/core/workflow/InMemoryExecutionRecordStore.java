package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryExecutionRecordStore implements ExecutionRecordStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionRecordStore.class);

    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryExecutionRecordStore() {
        this(Clock.systemUTC());
    }

    InMemoryExecutionRecordStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ExecutionRecord create(String executionId, String workflowId, JsonNode inputs) {
        return records.computeIfAbsent(executionId, id -> new ExecutionRecord(
                id, workflowId, ExecutionStatus.PENDING, inputs, null, null, clock.instant(), null, null));
    }

    @Override
    public ExecutionRecord transition(String executionId, ExecutionStatus status, JsonNode outputs, String error) {
        ExecutionRecord updated = records.compute(executionId, (id, current) -> {
            if (current == null) {
                throw new NoSuchElementException("No execution record " + id);
            }
            if (current.status().isTerminal() && current.status() != status) {
                throw new IllegalStateException("Execution " + id + " is already "
                        + current.status().wireName() + "; cannot move to " + status.wireName());
            }
            return current.withStatus(status, outputs, error, clock.instant());
        });
        log.debug("Execution record {} -> {}", executionId, status.wireName());
        return updated;
    }

    @Override
    public Optional<ExecutionRecord> find(String executionId) {
        return Optional.ofNullable(records.get(executionId));
    }

    @Override
    public List<ExecutionRecord> list() {
        List<ExecutionRecord> all = new ArrayList<>(records.values());
        all.sort(Comparator.comparing(ExecutionRecord::createdAt));
        return all;
    }
}
