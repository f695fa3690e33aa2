package com.flowkeeper.core.substrate;

import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * The primitives an orchestration may use. Everything that is not a pure
 * function of the orchestration input must go through this interface so that
 * a run can be replayed from its journal after a crash.
 * <p>
 * Continuation is requested through {@link #continueAsNew(Object)}.
 */
public interface DurableContext {

    /** Externally visible execution id; unchanged across continuations. */
    String executionId();

    /** Run number within the execution, starting at 1 and incremented on every continuation. */
    int runId();

    /** True while the orchestration is re-executing journaled history. */
    boolean isReplaying();

    /**
     * Invokes a side effect with the given retry policy and timeouts. The result
     * (or terminal failure) is journaled; on replay it is returned without
     * running the activity again.
     *
     * @throws ActivityFailureException when all attempts failed
     */
    <T> T executeActivity(String name, ActivityOptions options, Class<T> resultType, Activity<T> activity);

    /** Durable timer. */
    void sleep(Duration duration);

    /**
     * Suspends until {@code condition} holds or {@code timeout} elapses. The
     * deadline and the outcome are journaled.
     *
     * @return true if the condition became true, false on timeout
     */
    boolean await(Duration timeout, BooleanSupplier condition);

    <T> SignalChannel<T> signalChannel(String name, Class<T> payloadType);

    /** Deterministic wall-clock time. */
    Instant currentTime();

    /** Deterministic random UUID. */
    String randomUuid();

    /** Records the value of {@code supplier} once and replays it afterwards. */
    <T> T sideEffect(String name, Class<T> type, Supplier<T> supplier);

    /**
     * Ends the current run; the host starts a new run of the same execution with
     * {@code nextInput} as its input. Never returns normally. The return type lets
     * callers write {@code throw ctx.continueAsNew(input)}.
     */
    default ContinueAsNewException continueAsNew(Object nextInput) {
        throw new ContinueAsNewException(nextInput);
    }
}
