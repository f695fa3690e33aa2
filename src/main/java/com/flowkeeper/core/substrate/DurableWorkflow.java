package com.flowkeeper.core.substrate;

/**
 * An orchestration function hosted by a {@link DurableExecutionHost}.
 * <p>
 * Implementations must be deterministic with respect to their input and the
 * values returned by the {@link DurableContext}.
 *
 * @param <I> input type (JSON-convertible, also used as continuation payload)
 * @param <O> result type (JSON-convertible)
 */
public interface DurableWorkflow<I, O> {

    /** Stable type name recorded in the journal and used to find the workflow on resume. */
    String type();

    Class<I> inputType();

    Class<O> outputType();

    O run(DurableContext context, I input);
}
