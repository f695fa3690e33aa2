package com.flowkeeper.core.substrate;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;

/**
 * One journaled command outcome of a run.
 *
 * @param sequence   position within the run's history, starting at 0
 * @param kind       what produced the event
 * @param name       activity, timer, signal or side-effect name
 * @param value      recorded result (activity result, deadline, condition outcome, consumed payload)
 * @param failure    terminal failure message of an activity, {@code null} on success
 * @param attempts   attempts used by an activity, 0 for other kinds
 * @param recordedAt epoch millis when the event was recorded
 */
public record HistoryEvent(
    int sequence,
    Kind kind,
    String name,
    JsonNode value,
    String failure,
    int attempts,
    long recordedAt
) implements Serializable {

    public enum Kind {
        ACTIVITY,
        TIMER_STARTED,
        CONDITION,
        SIGNAL_CONSUMED,
        SIDE_EFFECT
    }

    public boolean failed() {
        return failure != null;
    }

    /** Human-readable command label, used in non-determinism reports. */
    public String label() {
        return kind + "(" + name + ")";
    }
}
