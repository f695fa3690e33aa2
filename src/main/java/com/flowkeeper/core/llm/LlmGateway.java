package com.flowkeeper.core.llm;

/**
 * Port to a chat model. Implementations are called from activities and may
 * block; they are retried by the caller.
 */
public interface LlmGateway {

    /**
     * @throws LlmException if the provider call fails
     */
    LlmResponse call(LlmRequest request);
}
