package com.flowkeeper.core.substrate;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable in-memory journal of one execution. All access is synchronized on
 * the journal; signal deliveries call {@link #notifyAll()} so that a waiting
 * orchestration thread re-evaluates its condition.
 */
final class ExecutionJournal {

    private final String executionId;
    private final String workflowType;
    private final long startedAt;

    private int runId;
    private JournalStatus status;
    private JsonNode input;
    private final List<HistoryEvent> history = new ArrayList<>();
    private final Map<String, List<JsonNode>> signals = new LinkedHashMap<>();
    private final Map<String, Integer> consumedSignals = new HashMap<>();
    private final List<String> deliveryOrder = new ArrayList<>();
    private JsonNode result;
    private String failure;
    private long updatedAt;

    private ExecutionJournal(String executionId, String workflowType, long startedAt) {
        this.executionId = executionId;
        this.workflowType = workflowType;
        this.startedAt = startedAt;
    }

    static ExecutionJournal open(String executionId, String workflowType, JsonNode input, long now) {
        ExecutionJournal journal = new ExecutionJournal(executionId, workflowType, now);
        journal.runId = 1;
        journal.status = JournalStatus.RUNNING;
        journal.input = input;
        journal.updatedAt = now;
        return journal;
    }

    static ExecutionJournal restore(JournalSnapshot snapshot) {
        ExecutionJournal journal = new ExecutionJournal(
                snapshot.executionId(), snapshot.workflowType(), snapshot.startedAt());
        journal.runId = snapshot.runId();
        journal.status = snapshot.status();
        journal.input = snapshot.input();
        journal.history.addAll(snapshot.history());
        snapshot.signals().forEach((name, values) -> journal.signals.put(name, new ArrayList<>(values)));
        journal.consumedSignals.putAll(snapshot.consumedSignals());
        journal.deliveryOrder.addAll(snapshot.deliveryOrder());
        journal.result = snapshot.result();
        journal.failure = snapshot.failure();
        journal.updatedAt = snapshot.updatedAt();
        return journal;
    }

    synchronized JournalSnapshot snapshot() {
        Map<String, List<JsonNode>> signalCopy = new LinkedHashMap<>();
        signals.forEach((name, values) -> signalCopy.put(name, List.copyOf(values)));
        return new JournalSnapshot(executionId, workflowType, runId, status, input,
                history, signalCopy, consumedSignals, deliveryOrder, result, failure, startedAt, updatedAt);
    }

    /** Saves a snapshot while holding the journal lock so saves are never reordered. */
    synchronized void persist(JournalStore store) {
        store.save(snapshot());
    }

    String executionId() {
        return executionId;
    }

    String workflowType() {
        return workflowType;
    }

    synchronized int runId() {
        return runId;
    }

    synchronized JournalStatus status() {
        return status;
    }

    synchronized JsonNode input() {
        return input;
    }

    synchronized JsonNode result() {
        return result;
    }

    synchronized String failure() {
        return failure;
    }

    synchronized int historySize() {
        return history.size();
    }

    /** Event at the given position of the current run, or null past the end. */
    synchronized HistoryEvent historyAt(int sequence) {
        return sequence < history.size() ? history.get(sequence) : null;
    }

    synchronized HistoryEvent append(HistoryEvent.Kind kind, String name, JsonNode value,
                                     String failure, int attempts, long now) {
        HistoryEvent event = new HistoryEvent(history.size(), kind, name, value, failure, attempts, now);
        history.add(event);
        updatedAt = now;
        return event;
    }

    // --- signals ---

    synchronized void deliverSignal(String name, JsonNode payload, long now) {
        signals.computeIfAbsent(name, k -> new ArrayList<>()).add(payload);
        deliveryOrder.add(name);
        updatedAt = now;
        notifyAll();
    }

    synchronized boolean hasPendingSignal(String name) {
        return receivedCount(name) > consumedSignals.getOrDefault(name, 0);
    }

    synchronized Optional<JsonNode> latestPending(String name) {
        if (!hasPendingSignal(name)) {
            return Optional.empty();
        }
        List<JsonNode> values = signals.get(name);
        return Optional.of(values.get(values.size() - 1));
    }

    /**
     * Marks every delivery received so far as consumed and returns the latest.
     *
     * @return the consumed value and the absolute delivery count, or empty if nothing was pending
     */
    synchronized Optional<ConsumedSignal> consumeLatest(String name) {
        Optional<JsonNode> latest = latestPending(name);
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        int count = receivedCount(name);
        consumedSignals.put(name, count);
        return Optional.of(new ConsumedSignal(latest.get(), count));
    }

    /** Re-applies a journaled consumption during replay. */
    synchronized void markConsumed(String name, int count) {
        consumedSignals.merge(name, count, Math::max);
    }

    private int receivedCount(String name) {
        List<JsonNode> values = signals.get(name);
        return values == null ? 0 : values.size();
    }

    // --- lifecycle ---

    /**
     * Starts a new run: history is dropped, consumed deliveries are discarded and
     * unconsumed ones carry over.
     */
    synchronized void continueAsNew(JsonNode nextInput, long now) {
        runId++;
        input = nextInput;
        history.clear();
        Map<String, List<JsonNode>> carried = new LinkedHashMap<>();
        signals.forEach((name, values) -> {
            int consumed = consumedSignals.getOrDefault(name, 0);
            if (consumed < values.size()) {
                carried.put(name, new ArrayList<>(values.subList(consumed, values.size())));
            }
        });
        List<String> pendingOrder = snapshot().pendingSignals();
        signals.clear();
        signals.putAll(carried);
        consumedSignals.clear();
        deliveryOrder.clear();
        deliveryOrder.addAll(pendingOrder);
        updatedAt = now;
    }

    synchronized void complete(JsonNode value, long now) {
        status = JournalStatus.COMPLETED;
        result = value;
        updatedAt = now;
        notifyAll();
    }

    synchronized void fail(String message, long now) {
        status = JournalStatus.FAILED;
        failure = message;
        updatedAt = now;
        notifyAll();
    }

    record ConsumedSignal(JsonNode value, int count) {}
}
