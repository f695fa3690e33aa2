package com.flowkeeper.core.substrate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flowkeeper.core.metrics.FlowkeeperMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/**
 * Helpers for building hosts and ad-hoc orchestrations in tests.
 */
public final class TestWorkflows {

    public static final ObjectMapper MAPPER = JsonMapper.builder().findAndAddModules().build();

    private TestWorkflows() {
    }

    /** Records requested retry delays instead of sleeping. */
    public static final class RecordingSleeper implements Sleeper {

        private final List<Duration> delays = new CopyOnWriteArrayList<>();

        @Override
        public void sleep(Duration duration) {
            delays.add(duration);
        }

        public List<Duration> delays() {
            return delays;
        }
    }

    public static InProcessExecutionHost host(JournalStore store) {
        return host(store, new RecordingSleeper());
    }

    public static InProcessExecutionHost host(JournalStore store, Sleeper sleeper) {
        return new InProcessExecutionHost(store, MAPPER, new FlowkeeperMetrics(new SimpleMeterRegistry()),
                2, sleeper, Clock.systemUTC());
    }

    public static <I, O> DurableWorkflow<I, O> workflow(String type, Class<I> inputType, Class<O> outputType,
                                                        BiFunction<DurableContext, I, O> body) {
        return new DurableWorkflow<>() {
            @Override
            public String type() {
                return type;
            }

            @Override
            public Class<I> inputType() {
                return inputType;
            }

            @Override
            public Class<O> outputType() {
                return outputType;
            }

            @Override
            public O run(DurableContext context, I input) {
                return body.apply(context, input);
            }
        };
    }

    /** Simulates the process dying mid-run: the journal stays open. */
    public static RuntimeException crash() {
        return new CancellationException("simulated crash");
    }

    public static ActivityOptions quick(int attempts) {
        return ActivityOptions.of(Duration.ofSeconds(5),
                new RetryPolicy(attempts, 2.0, Duration.ofSeconds(1), Duration.ofSeconds(100)));
    }
}
