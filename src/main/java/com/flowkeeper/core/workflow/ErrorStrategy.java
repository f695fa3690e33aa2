package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the orchestrator does after a node's body has failed for good.
 */
public enum ErrorStrategy {
    /** Record the failure; dependents are marked failed without running and the run fails. */
    FAIL,
    /** Ignore the failure and visit dependents. */
    CONTINUE,
    /** Merge the policy's fallback value into the context and visit dependents. */
    FALLBACK,
    /** Visit the policy's goto node instead of the dependents. */
    GOTO;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ErrorStrategy fromWire(String value) {
        if (value == null || value.isBlank()) {
            return FAIL;
        }
        for (ErrorStrategy strategy : values()) {
            if (strategy.wireName().equalsIgnoreCase(value.trim())) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown onError strategy: " + value);
    }
}
