package com.flowkeeper.core.substrate;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for execution journals.
 */
public interface JournalStore {

    void save(JournalSnapshot snapshot);

    Optional<JournalSnapshot> load(String executionId);

    /**
     * Drops the stored runs of the execution numbered below {@code runId}. Called
     * only after run {@code runId} has been saved, so a failure here leaves an
     * extra stale run behind and never loses the execution.
     */
    void releaseRunsBefore(String executionId, int runId);

    List<String> listExecutionIds();
}
