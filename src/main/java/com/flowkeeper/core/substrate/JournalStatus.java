package com.flowkeeper.core.substrate;

/**
 * Lifecycle of an execution journal.
 */
public enum JournalStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
