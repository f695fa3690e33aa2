package com.flowkeeper.core.llm;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmConfig {

    @Bean
    @ConditionalOnMissingBean(LlmGateway.class)
    public LlmGateway unconfiguredLlmGateway() {
        return new UnconfiguredLlmGateway();
    }
}
