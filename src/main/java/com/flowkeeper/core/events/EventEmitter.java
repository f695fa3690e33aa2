package com.flowkeeper.core.events;

import com.flowkeeper.core.substrate.ActivityFailureException;
import com.flowkeeper.core.substrate.ActivityOptions;
import com.flowkeeper.core.substrate.DurableContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Emits lifecycle events from inside an orchestration. Each emission is a
 * single-attempt activity with a five second timeout; failures are logged and
 * dropped.
 */
@Component
public class EventEmitter {

    private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);

    private final TelemetrySink sink;

    public EventEmitter(TelemetrySink sink) {
        this.sink = sink;
    }

    public void emit(DurableContext ctx, EventType type, Map<String, Object> payload) {
        emit(ctx, type, null, payload);
    }

    public void emit(DurableContext ctx, EventType type, String nodeId, Map<String, Object> payload) {
        try {
            ctx.executeActivity("emit:" + type.wireName(), ActivityOptions.EVENT_EMISSION, Boolean.class, activity -> {
                sink.emit(new FlowEvent(type.wireName(), ctx.executionId(), nodeId, payload, Instant.now()));
                return Boolean.TRUE;
            });
        } catch (ActivityFailureException e) {
            log.debug("Dropped {} event for {}: {}", type.wireName(), ctx.executionId(), e.getMessage());
        }
    }
}
