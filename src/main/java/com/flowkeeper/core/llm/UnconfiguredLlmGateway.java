package com.flowkeeper.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default gateway when no provider transport is on the context. Every call fails.
 */
public class UnconfiguredLlmGateway implements LlmGateway {

    private static final Logger log = LoggerFactory.getLogger(UnconfiguredLlmGateway.class);

    @Override
    public LlmResponse call(LlmRequest request) {
        log.warn("LLM call for model '{}' rejected: no LlmGateway bean configured", request.model());
        throw new LlmException("No LLM provider configured for model '" + request.model()
                + "' (provider '" + request.provider() + "'). Register an LlmGateway bean.");
    }
}
