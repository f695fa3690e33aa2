package com.flowkeeper.core.signal;

import com.flowkeeper.core.metrics.FlowkeeperMetrics;
import com.flowkeeper.core.substrate.DurableContext;
import com.flowkeeper.core.substrate.DurableWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Pauses until a person answers a prompt through the {@value #SIGNAL} signal,
 * or until the request's timeout elapses.
 */
@Component
public class HumanInputWorkflow implements DurableWorkflow<HumanInputRequest, HumanInputResult> {

    private static final Logger log = LoggerFactory.getLogger(HumanInputWorkflow.class);

    public static final String TYPE = "human-input";
    public static final String SIGNAL = "userInput";

    private final FlowkeeperMetrics metrics;

    public HumanInputWorkflow(FlowkeeperMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Class<HumanInputRequest> inputType() {
        return HumanInputRequest.class;
    }

    @Override
    public Class<HumanInputResult> outputType() {
        return HumanInputResult.class;
    }

    @Override
    public HumanInputResult run(DurableContext ctx, HumanInputRequest request) {
        Duration timeout = request.effectiveTimeout();
        log.info("Waiting for user input on node {}: \"{}\"", request.nodeId(), request.prompt());

        WaitResult<String> result = SignalWait.on(ctx, SIGNAL, String.class).await(timeout);
        if (!ctx.isReplaying()) {
            metrics.recordSignalWait(SIGNAL, result.received());
        }
        if (result.timedOut()) {
            log.info("User input timed out for node {}", request.nodeId());
            return HumanInputResult.timedOut(timeout.toMillis());
        }
        return HumanInputResult.answered(result.value());
    }
}
