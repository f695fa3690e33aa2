package com.flowkeeper.core.substrate;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, JSON-convertible copy of an {@link ExecutionJournal}. This is the
 * unit stored by a {@link JournalStore}.
 *
 * @param executionId     externally visible execution id
 * @param workflowType    {@link DurableWorkflow#type()} of the orchestration
 * @param runId           current run number (incremented by continue-as-new)
 * @param status          journal status
 * @param input           input of the current run
 * @param history         events of the current run, in sequence order
 * @param signals         deliveries per signal name, in arrival order
 * @param consumedSignals number of deliveries already consumed per signal name
 * @param deliveryOrder   signal name of every delivery, in arrival order across names
 * @param result          orchestration result once completed
 * @param failure         failure message once failed
 * @param startedAt       epoch millis of the first run's start
 * @param updatedAt       epoch millis of the last change
 */
public record JournalSnapshot(
    String executionId,
    String workflowType,
    int runId,
    JournalStatus status,
    JsonNode input,
    List<HistoryEvent> history,
    Map<String, List<JsonNode>> signals,
    Map<String, Integer> consumedSignals,
    List<String> deliveryOrder,
    JsonNode result,
    String failure,
    long startedAt,
    long updatedAt
) implements Serializable {

    public JournalSnapshot {
        history = history != null ? List.copyOf(history) : List.of();
        signals = signals != null ? Collections.unmodifiableMap(new LinkedHashMap<>(signals)) : Map.of();
        consumedSignals = consumedSignals != null ? Map.copyOf(consumedSignals) : Map.of();
        deliveryOrder = deliveryOrder != null ? List.copyOf(deliveryOrder) : List.of();
    }

    /** Number of deliveries not yet consumed, summed over all signal names. */
    public int pendingSignalCount() {
        int pending = 0;
        for (var entry : signals.entrySet()) {
            pending += entry.getValue().size() - consumedSignals.getOrDefault(entry.getKey(), 0);
        }
        return pending;
    }

    /** Signal names of the unconsumed deliveries, in the order they arrived. */
    public List<String> pendingSignals() {
        Map<String, Integer> seen = new HashMap<>();
        List<String> pending = new ArrayList<>();
        for (String name : deliveryOrder) {
            int index = seen.merge(name, 1, Integer::sum) - 1;
            if (index >= consumedSignals.getOrDefault(name, 0)) {
                pending.add(name);
            }
        }
        return pending;
    }
}
