package com.flowkeeper.core.substrate;

/**
 * A unit of side-effecting work invoked by an orchestration through
 * {@link DurableContext#executeActivity}.
 *
 * @param <T> result type; must be convertible to JSON so it can be journaled
 */
@FunctionalInterface
public interface Activity<T> {

    T run(ActivityContext context) throws Exception;
}
