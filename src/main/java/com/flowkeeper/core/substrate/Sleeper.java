package com.flowkeeper.core.substrate;

import java.time.Duration;

/**
 * Blocking pause used between activity attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
