package com.flowkeeper.core.substrate;

/**
 * A single activity attempt exceeded its start-to-close or heartbeat timeout.
 */
public class ActivityTimeoutException extends RuntimeException {

    public enum Kind { START_TO_CLOSE, HEARTBEAT }

    private final Kind kind;

    public ActivityTimeoutException(String activityName, Kind kind, long elapsedMs) {
        super("Activity " + activityName + " timed out (" + kind.name().toLowerCase().replace('_', '-')
                + ") after " + elapsedMs + "ms");
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
