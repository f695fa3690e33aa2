package com.flowkeeper.core.signal;

public record HumanInputResult(
    boolean success,
    String userResponse,
    boolean timedOut,
    String error
) {

    public static HumanInputResult answered(String userResponse) {
        return new HumanInputResult(true, userResponse, false, null);
    }

    public static HumanInputResult timedOut(long timeoutMs) {
        return new HumanInputResult(false, null, true, "User input timed out after " + timeoutMs + "ms");
    }
}
