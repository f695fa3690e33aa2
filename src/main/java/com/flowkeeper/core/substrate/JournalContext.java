package com.flowkeeper.core.substrate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * {@link DurableContext} backed by an {@link ExecutionJournal}. Commands are
 * matched against recorded history by position; once the cursor passes the end
 * of history the context runs live and appends.
 * <p>
 * One instance per run, used by a single orchestration thread.
 */
final class JournalContext implements DurableContext {

    private static final Logger log = LoggerFactory.getLogger(JournalContext.class);

    /** Upper bound on a single wait so conditions that are not signal-driven are re-checked. */
    private static final long MAX_WAIT_SLICE_MILLIS = 100;

    private final ExecutionJournal journal;
    private final JournalStore store;
    private final ActivityRunner runner;
    private final ObjectMapper mapper;
    private final Clock clock;
    private int cursor;

    JournalContext(ExecutionJournal journal, JournalStore store, ActivityRunner runner,
                   ObjectMapper mapper, Clock clock) {
        this.journal = journal;
        this.store = store;
        this.runner = runner;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String executionId() {
        return journal.executionId();
    }

    @Override
    public int runId() {
        return journal.runId();
    }

    @Override
    public boolean isReplaying() {
        return cursor < journal.historySize();
    }

    @Override
    public <T> T executeActivity(String name, ActivityOptions options, Class<T> resultType, Activity<T> activity) {
        HistoryEvent recorded = replayNext(HistoryEvent.Kind.ACTIVITY, name);
        if (recorded != null) {
            if (recorded.failed()) {
                throw new ActivityFailureException(name, recorded.attempts(), recorded.failure(), null);
            }
            return decode(recorded.value(), resultType);
        }

        ActivityRunner.Outcome<T> outcome = runner.run(executionId(), name, options, activity);
        if (outcome.failure() instanceof InterruptedException) {
            throw new CancellationException("Interrupted while running activity " + name);
        }
        if (!outcome.succeeded()) {
            ActivityFailureException failure =
                    new ActivityFailureException(name, outcome.attempts(), outcome.failure());
            record(HistoryEvent.Kind.ACTIVITY, name, NullNode.getInstance(), failure.getMessage(), outcome.attempts());
            throw failure;
        }
        JsonNode value = encode(outcome.value());
        record(HistoryEvent.Kind.ACTIVITY, name, value, null, outcome.attempts());
        return decode(value, resultType);
    }

    @Override
    public void sleep(Duration duration) {
        awaitUntil("sleep", duration, () -> false);
    }

    @Override
    public boolean await(Duration timeout, BooleanSupplier condition) {
        return awaitUntil("condition", timeout, condition);
    }

    private boolean awaitUntil(String name, Duration timeout, BooleanSupplier condition) {
        HistoryEvent timer = replayNext(HistoryEvent.Kind.TIMER_STARTED, name);
        long deadline;
        if (timer != null) {
            deadline = timer.value().asLong();
        } else {
            deadline = clock.millis() + timeout.toMillis();
            record(HistoryEvent.Kind.TIMER_STARTED, name, LongNode.valueOf(deadline), null, 0);
        }

        HistoryEvent outcome = replayNext(HistoryEvent.Kind.CONDITION, name);
        if (outcome != null) {
            return outcome.value().asBoolean();
        }

        // Live, or resumed after a crash between the timer and its outcome.
        boolean satisfied = waitFor(deadline, condition);
        record(HistoryEvent.Kind.CONDITION, name, BooleanNode.valueOf(satisfied), null, 0);
        return satisfied;
    }

    private boolean waitFor(long deadline, BooleanSupplier condition) {
        synchronized (journal) {
            while (true) {
                if (condition.getAsBoolean()) {
                    return true;
                }
                long remaining = deadline - clock.millis();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    journal.wait(Math.min(remaining, MAX_WAIT_SLICE_MILLIS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while waiting in " + executionId());
                }
            }
        }
    }

    @Override
    public <T> SignalChannel<T> signalChannel(String name, Class<T> payloadType) {
        return new JournalSignalChannel<>(name, payloadType);
    }

    @Override
    public Instant currentTime() {
        return Instant.ofEpochMilli(sideEffect("currentTime", Long.class, clock::millis));
    }

    @Override
    public String randomUuid() {
        return sideEffect("randomUuid", String.class, () -> UUID.randomUUID().toString());
    }

    @Override
    public <T> T sideEffect(String name, Class<T> type, Supplier<T> supplier) {
        HistoryEvent recorded = replayNext(HistoryEvent.Kind.SIDE_EFFECT, name);
        if (recorded != null) {
            return decode(recorded.value(), type);
        }
        JsonNode value = encode(supplier.get());
        record(HistoryEvent.Kind.SIDE_EFFECT, name, value, null, 0);
        return decode(value, type);
    }

    // --- journal plumbing ---

    private HistoryEvent replayNext(HistoryEvent.Kind kind, String name) {
        HistoryEvent event = journal.historyAt(cursor);
        if (event == null) {
            return null;
        }
        if (event.kind() != kind || !event.name().equals(name)) {
            throw new NonDeterministicWorkflowException(executionId(), cursor, event.label(), kind + "(" + name + ")");
        }
        cursor++;
        return event;
    }

    private void record(HistoryEvent.Kind kind, String name, JsonNode value, String failure, int attempts) {
        HistoryEvent event = journal.append(kind, name, value, failure, attempts, clock.millis());
        cursor++;
        journal.persist(store);
        log.debug("Recorded {} #{} for {}", event.label(), event.sequence(), executionId());
    }

    private JsonNode encode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        JsonNode node = mapper.valueToTree(value);
        return node != null ? node : NullNode.getInstance();
    }

    private <T> T decode(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.convertValue(node, type);
    }

    private final class JournalSignalChannel<T> implements SignalChannel<T> {

        private final String name;
        private final Class<T> payloadType;

        JournalSignalChannel(String name, Class<T> payloadType) {
            this.name = name;
            this.payloadType = payloadType;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean hasPending() {
            return journal.hasPendingSignal(name);
        }

        @Override
        public Optional<T> peek() {
            return journal.latestPending(name).map(node -> decode(node, payloadType));
        }

        @Override
        public T consume() {
            HistoryEvent recorded = replayNext(HistoryEvent.Kind.SIGNAL_CONSUMED, name);
            if (recorded != null) {
                journal.markConsumed(name, recorded.value().path("deliveries").asInt());
                return decode(recorded.value().get("payload"), payloadType);
            }
            ExecutionJournal.ConsumedSignal consumed = journal.consumeLatest(name)
                    .orElseThrow(() -> new IllegalStateException("No pending '" + name + "' signal for " + executionId()));
            ObjectNode value = mapper.createObjectNode();
            value.set("payload", consumed.value());
            value.put("deliveries", consumed.count());
            record(HistoryEvent.Kind.SIGNAL_CONSUMED, name, value, null, 0);
            return decode(consumed.value(), payloadType);
        }
    }
}
