package com.flowkeeper.core.substrate;

import java.util.Optional;

/**
 * Durable named inbound channel of one execution.
 * <p>
 * Deliveries are journaled as they arrive. The most recent unconsumed value is
 * retained until {@link #consume()} is called, which also discards any older
 * unconsumed deliveries.
 *
 * @param <T> payload type
 */
public interface SignalChannel<T> {

    String name();

    /** True when at least one delivery has not been consumed. Does not consume. */
    boolean hasPending();

    /** The most recent unconsumed delivery, without consuming it. */
    Optional<T> peek();

    /**
     * Consumes the most recent delivery. The consumption is journaled so replay
     * returns the same value.
     *
     * @throws IllegalStateException if nothing is pending
     */
    T consume();
}
