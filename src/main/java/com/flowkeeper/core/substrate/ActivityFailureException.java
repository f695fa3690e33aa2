package com.flowkeeper.core.substrate;

/**
 * Terminal failure of an activity: every attempt allowed by the retry policy
 * failed, or the failure was {@link NonRetryable}.
 */
public class ActivityFailureException extends RuntimeException {

    private final String activityName;
    private final int attempts;

    public ActivityFailureException(String activityName, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.activityName = activityName;
        this.attempts = attempts;
    }

    public ActivityFailureException(String activityName, int attempts, Throwable cause) {
        this(activityName, attempts, messageOf(cause), cause);
    }

    public String activityName() {
        return activityName;
    }

    public int attempts() {
        return attempts;
    }

    private static String messageOf(Throwable cause) {
        if (cause == null) {
            return "Unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
