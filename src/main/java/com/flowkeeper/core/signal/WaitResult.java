package com.flowkeeper.core.signal;

/**
 * Outcome of {@link SignalWait#await}.
 *
 * @param received true if a value arrived before the timeout
 * @param value    the received value, {@code null} on timeout
 * @param timedOut true if the timeout elapsed first
 */
public record WaitResult<T>(boolean received, T value, boolean timedOut) {

    public static <T> WaitResult<T> received(T value) {
        return new WaitResult<>(true, value, false);
    }

    public static <T> WaitResult<T> timeout() {
        return new WaitResult<>(false, null, true);
    }
}
