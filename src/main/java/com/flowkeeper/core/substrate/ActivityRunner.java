package com.flowkeeper.core.substrate;

import com.flowkeeper.core.metrics.FlowkeeperMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs activity attempts on a worker pool, enforcing timeouts and the retry
 * schedule. Orchestration threads block here; journaling is the caller's job.
 */
class ActivityRunner {

    private static final Logger log = LoggerFactory.getLogger(ActivityRunner.class);

    /** How often a running attempt is checked for a stale heartbeat. */
    private static final long POLL_MILLIS = 50;

    private final ExecutorService pool;
    private final Sleeper sleeper;
    private final FlowkeeperMetrics metrics;

    ActivityRunner(ExecutorService pool, Sleeper sleeper, FlowkeeperMetrics metrics) {
        this.pool = pool;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Outcome of all attempts: the value on success, or the last failure.
     */
    record Outcome<T>(T value, Throwable failure, int attempts) {
        boolean succeeded() {
            return failure == null;
        }
    }

    <T> Outcome<T> run(String executionId, String name, ActivityOptions options, Activity<T> activity) {
        RetryPolicy retry = options.retryPolicy();
        Throwable lastFailure = null;
        int attempt = 0;
        long started = System.currentTimeMillis();

        while (attempt < retry.maximumAttempts()) {
            attempt++;
            if (attempt > 1) {
                Duration delay = retry.delayBeforeAttempt(attempt);
                log.info("Retrying activity {} (attempt {}/{}) after {}ms",
                        name, attempt, retry.maximumAttempts(), delay.toMillis());
                metrics.recordActivityRetry(name);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new Outcome<>(null, e, attempt - 1);
                }
            }
            try {
                T value = runAttempt(executionId, name, attempt, options, activity);
                metrics.recordActivityDuration(name, System.currentTimeMillis() - started, true);
                return new Outcome<>(value, null, attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastFailure = e;
                break;
            } catch (Exception e) {
                lastFailure = e;
                if (e instanceof ActivityTimeoutException timeout) {
                    metrics.recordActivityTimeout(name, timeout.kind().name().toLowerCase());
                }
                if (e instanceof NonRetryable) {
                    log.warn("Activity {} failed with non-retryable error: {}", name, e.getMessage());
                    break;
                }
                log.warn("Activity {} attempt {}/{} failed: {}",
                        name, attempt, retry.maximumAttempts(), e.getMessage());
            }
        }
        metrics.recordActivityDuration(name, System.currentTimeMillis() - started, false);
        return new Outcome<>(null, lastFailure, attempt);
    }

    private <T> T runAttempt(String executionId, String name, int attempt,
                             ActivityOptions options, Activity<T> activity) throws Exception {
        AttemptContext context = new AttemptContext(executionId, name, attempt);
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = pool.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return activity.run(context);
            } finally {
                MDC.clear();
            }
        });

        long startNanos = System.nanoTime();
        long closeDeadline = startNanos + options.startToCloseTimeout().toNanos();
        Duration heartbeatTimeout = options.heartbeatTimeout();
        try {
            while (true) {
                long now = System.nanoTime();
                if (now >= closeDeadline) {
                    throw timeout(future, name, ActivityTimeoutException.Kind.START_TO_CLOSE, startNanos);
                }
                if (heartbeatTimeout != null
                        && now - context.lastHeartbeatNanos >= heartbeatTimeout.toNanos()) {
                    throw timeout(future, name, ActivityTimeoutException.Kind.HEARTBEAT, startNanos);
                }
                long waitNanos = closeDeadline - now;
                if (heartbeatTimeout != null) {
                    waitNanos = Math.min(waitNanos, TimeUnit.MILLISECONDS.toNanos(POLL_MILLIS));
                }
                try {
                    return future.get(waitNanos, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    // loop re-checks both deadlines
                }
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static ActivityTimeoutException timeout(Future<?> future, String name,
                                                    ActivityTimeoutException.Kind kind, long startNanos) {
        future.cancel(true);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return new ActivityTimeoutException(name, kind, elapsedMs);
    }

    private static final class AttemptContext implements ActivityContext {

        private final String executionId;
        private final String activityName;
        private final int attempt;
        private volatile long lastHeartbeatNanos = System.nanoTime();

        AttemptContext(String executionId, String activityName, int attempt) {
            this.executionId = executionId;
            this.activityName = activityName;
            this.attempt = attempt;
        }

        @Override
        public String executionId() {
            return executionId;
        }

        @Override
        public String activityName() {
            return activityName;
        }

        @Override
        public int attempt() {
            return attempt;
        }

        @Override
        public void heartbeat(Object details) {
            lastHeartbeatNanos = System.nanoTime();
            if (details != null) {
                log.debug("Heartbeat from {} attempt {}: {}", activityName, attempt, details);
            }
        }
    }
}
