package com.flowkeeper.core.substrate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed {@link JournalStore} for tests. Counts saves so tests can check
 * that journals are written as events are recorded.
 */
public class TestJournalStore implements JournalStore {

    private final Map<String, JournalSnapshot> journals = new TreeMap<>();
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public synchronized void save(JournalSnapshot snapshot) {
        journals.put(snapshot.executionId(), snapshot);
        saves.incrementAndGet();
    }

    @Override
    public synchronized Optional<JournalSnapshot> load(String executionId) {
        return Optional.ofNullable(journals.get(executionId));
    }

    @Override
    public synchronized void releaseRunsBefore(String executionId, int runId) {
        // Only the latest run is kept here; save already replaced older ones.
        journals.computeIfPresent(executionId, (id, snapshot) -> snapshot.runId() < runId ? null : snapshot);
    }

    @Override
    public synchronized List<String> listExecutionIds() {
        return List.copyOf(journals.keySet());
    }

    public int saveCount() {
        return saves.get();
    }
}
