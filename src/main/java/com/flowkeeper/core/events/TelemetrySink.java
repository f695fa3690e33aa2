package com.flowkeeper.core.events;

/**
 * Outbound port for lifecycle events. Implementations may drop events; a
 * failing sink never affects the orchestration that emitted the event.
 */
public interface TelemetrySink {

    void emit(FlowEvent event);
}
