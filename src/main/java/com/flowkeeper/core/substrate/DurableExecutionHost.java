package com.flowkeeper.core.substrate;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Contract of a durable-execution host.
 * <p>
 * Execution ids are idempotency keys: executing an id whose journal is already
 * completed returns the recorded result, and executing an id whose journal is
 * still open replays it.
 */
public interface DurableExecutionHost {

    /** Runs the orchestration on the calling thread until it completes or fails. */
    <I, O> O execute(String executionId, DurableWorkflow<I, O> workflow, I input);

    /** Runs the orchestration on the host's orchestration pool. */
    <I, O> CompletableFuture<O> start(String executionId, DurableWorkflow<I, O> workflow, I input);

    /**
     * Delivers a signal. Live executions are woken; suspended or crashed
     * executions see the signal once resumed.
     *
     * @throws UnknownExecutionException if no journal exists for the id
     */
    void signal(String executionId, String signalName, Object payload);

    /** Replays an open execution from its journal and continues it live. */
    <I, O> O resume(String executionId, DurableWorkflow<I, O> workflow);

    Optional<JournalSnapshot> describe(String executionId);

    List<String> listExecutionIds();
}
