package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Port for execution status rows. Writes are applied at least once, so both
 * operations must tolerate being repeated.
 */
public interface ExecutionRecordStore {

    /**
     * Creates a pending record, or returns the existing one unchanged.
     */
    ExecutionRecord create(String executionId, String workflowId, JsonNode inputs);

    /**
     * Moves a record to {@code status}. Repeating the current status is a no-op
     * apart from outputs and error.
     *
     * @throws IllegalStateException if the record is terminal and {@code status} differs
     * @throws java.util.NoSuchElementException if no record exists
     */
    ExecutionRecord transition(String executionId, ExecutionStatus status, JsonNode outputs, String error);

    Optional<ExecutionRecord> find(String executionId);

    List<ExecutionRecord> list();
}
