package com.flowkeeper.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowkeeper.core.agent.ConversationMessage;
import com.flowkeeper.core.agent.ConversationStore;
import com.flowkeeper.core.agent.MessageRole;
import com.flowkeeper.core.agent.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Agent conversations in a relational table, one row per message.
 * Message ids already stored for the execution are skipped on save.
 */
public class JdbcConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcConversationStore.class);

    private static final String TABLE_NAME = "flowkeeper_conversation_messages";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq           BIGINT GENERATED BY DEFAULT AS IDENTITY,
                execution_id  VARCHAR(255) NOT NULL,
                message_id    VARCHAR(255) NOT NULL,
                role          VARCHAR(32)  NOT NULL,
                content       TEXT,
                tool_calls    TEXT,
                tool_name     VARCHAR(255),
                tool_call_id  VARCHAR(255),
                created_at    BIGINT NOT NULL,
                PRIMARY KEY (execution_id, message_id)
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_IDS_SQL = """
            SELECT message_id FROM %s WHERE execution_id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (execution_id, message_id, role, content, tool_calls, tool_name, tool_call_id, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_EXECUTION_SQL = """
            SELECT message_id, role, content, tool_calls, tool_name, tool_call_id, created_at
            FROM %s
            WHERE execution_id = ?
            ORDER BY seq ASC
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcConversationStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Conversation table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public int saveMessages(String executionId, List<ConversationMessage> messages) {
        if (messages.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Set<String> existing = existingIds(conn, executionId);
                int written = 0;
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                    for (ConversationMessage message : messages) {
                        if (!existing.add(message.id())) {
                            continue;
                        }
                        stmt.setString(1, executionId);
                        stmt.setString(2, message.id());
                        stmt.setString(3, message.role().wireName());
                        stmt.setString(4, message.content());
                        stmt.setString(5, message.toolCalls().isEmpty() ? null : toJson(message.toolCalls()));
                        stmt.setString(6, message.toolName());
                        stmt.setString(7, message.toolCallId());
                        stmt.setLong(8, message.timestamp());
                        stmt.addBatch();
                        written++;
                    }
                    if (written > 0) {
                        stmt.executeBatch();
                    }
                }
                conn.commit();
                log.debug("Saved {} of {} message(s) for {}", written, messages.size(), executionId);
                return written;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save conversation messages for " + executionId, e);
        }
    }

    @Override
    public List<ConversationMessage> loadMessages(String executionId) {
        List<ConversationMessage> messages = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_EXECUTION_SQL)) {
            stmt.setString(1, executionId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    messages.add(new ConversationMessage(
                            rs.getString("message_id"),
                            MessageRole.fromWire(rs.getString("role")),
                            rs.getString("content"),
                            fromJson(rs.getString("tool_calls")),
                            rs.getString("tool_name"),
                            rs.getString("tool_call_id"),
                            rs.getLong("created_at")));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load conversation for " + executionId, e);
        }
        return messages;
    }

    private Set<String> existingIds(Connection conn, String executionId) throws SQLException {
        Set<String> ids = new HashSet<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_IDS_SQL)) {
            stmt.setString(1, executionId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
        }
        return ids;
    }

    private String toJson(List<ToolCall> toolCalls) {
        try {
            return objectMapper.writeValueAsString(toolCalls);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool calls", e);
        }
    }

    private List<ToolCall> fromJson(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize tool calls", e);
        }
    }
}
