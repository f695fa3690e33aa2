package com.flowkeeper.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted by an orchestration, consumed by CLI watch mode and
 * any other {@link EventBus} subscriber.
 *
 * @param eventType   wire name from {@link EventType} (e.g. "node.completed")
 * @param executionId the execution this event belongs to
 * @param nodeId      the DAG node or tool call this event relates to (nullable for execution-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record FlowEvent(
    String eventType,
    String executionId,
    String nodeId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
