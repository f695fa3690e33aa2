package com.flowkeeper.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowkeeper.core.agent.ConversationStore;
import com.flowkeeper.core.agent.InMemoryConversationStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Chooses the journal checkpoint saver and the conversation store.
 * <p>
 * When {@code flowkeeper.persistence.jdbc-url} is set, a pooled
 * {@link DataSource} backs a {@link JdbcCheckpointSaver} and a
 * {@link JdbcConversationStore}, and their tables are created on startup.
 * Otherwise in-memory fallbacks are used; suitable for development and tests
 * but nothing survives a restart.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    private static final String JDBC_URL = "jdbc-url";

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "flowkeeper.persistence", name = JDBC_URL)
    public DataSource flowkeeperDataSource(PersistenceProperties properties) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(properties.getJdbcUrl());
        config.setUsername(properties.getUsername());
        config.setPassword(properties.getPassword());
        config.setMaximumPoolSize(properties.getMaximumPoolSize());
        config.setPoolName("flowkeeper");
        log.info("Connecting journal storage to {}", properties.getJdbcUrl());
        return new HikariDataSource(config);
    }

    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "flowkeeper.persistence", name = JDBC_URL)
    public BaseCheckpointSaver jdbcCheckpointSaver(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC journal storage");
        var saver = new JdbcCheckpointSaver(dataSource);
        saver.createTables();
        return saver;
    }

    @Bean
    @ConditionalOnMissingBean(BaseCheckpointSaver.class)
    public BaseCheckpointSaver memoryCheckpointSaver() {
        log.info("No JDBC URL configured; journals are kept in memory (executions will not survive a restart)");
        return new MemorySaver();
    }

    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "flowkeeper.persistence", name = JDBC_URL)
    public ConversationStore jdbcConversationStore(DataSource dataSource, ObjectMapper objectMapper) throws Exception {
        var store = new JdbcConversationStore(dataSource, objectMapper);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(ConversationStore.class)
    public ConversationStore inMemoryConversationStore() {
        return new InMemoryConversationStore();
    }
}
