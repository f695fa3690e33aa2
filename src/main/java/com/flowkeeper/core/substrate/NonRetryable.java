package com.flowkeeper.core.substrate;

/**
 * Marker for exceptions that must fail an activity immediately instead of
 * consuming the remaining attempts of its retry policy.
 */
public interface NonRetryable {
}
