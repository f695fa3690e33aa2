package com.flowkeeper.core.substrate;

/**
 * Replay diverged from the journal: the orchestration issued a different
 * command than the one recorded at the same position.
 */
public class NonDeterministicWorkflowException extends RuntimeException {

    public NonDeterministicWorkflowException(String executionId, int sequence, String expected, String actual) {
        super("Execution " + executionId + " diverged from its history at event " + sequence
                + ": recorded " + expected + " but replay issued " + actual);
    }
}
