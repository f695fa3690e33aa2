package com.flowkeeper.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;

/**
 * JDBC-based {@link BaseCheckpointSaver} that stores execution journals as
 * LangGraph4j checkpoints, one row per {@code (thread_id, checkpoint_id)}.
 * <p>
 * The thread id is the execution id and each run of the execution gets its own
 * checkpoint id. Writes are an update followed by an insert when no row
 * matched, which works on PostgreSQL and H2 alike.
 */
public class JdbcCheckpointSaver implements BaseCheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointSaver.class);

    private static final String TABLE_NAME = "flowkeeper_journal";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                thread_id     VARCHAR(255) NOT NULL,
                checkpoint_id VARCHAR(255) NOT NULL,
                node_id       VARCHAR(255),
                next_node_id  VARCHAR(255),
                state         TEXT NOT NULL,
                updated_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (thread_id, checkpoint_id)
            )
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s
            SET node_id = ?, next_node_id = ?, state = ?, updated_at = CURRENT_TIMESTAMP
            WHERE thread_id = ? AND checkpoint_id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (thread_id, checkpoint_id, node_id, next_node_id, state)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_THREAD_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ?
            ORDER BY updated_at ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ? AND checkpoint_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ?
            ORDER BY updated_at DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_THREAD_SQL = """
            DELETE FROM %s WHERE thread_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_ID_SQL = """
            DELETE FROM %s WHERE thread_id = ? AND checkpoint_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_THREADS_SQL = """
            SELECT DISTINCT thread_id FROM %s ORDER BY thread_id
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointSaver(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the journal table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Journal table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        String threadId = resolveThreadId(config);
        List<Checkpoint> checkpoints = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list journal checkpoints for " + threadId, e);
        }
        return checkpoints;
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        String threadId = resolveThreadId(config);
        Optional<String> checkpointId = config.checkPointId();
        String sql = checkpointId.isPresent() ? SELECT_BY_ID_SQL : SELECT_LATEST_SQL;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, threadId);
            if (checkpointId.isPresent()) {
                stmt.setString(2, checkpointId.get());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load journal checkpoint for " + threadId
                    + " (" + checkpointId.orElse("latest") + ")", e);
        }
        return Optional.empty();
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) throws Exception {
        String threadId = resolveThreadId(config);
        String state = serializeState(checkpoint.getState());

        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                stmt.setString(1, checkpoint.getNodeId());
                stmt.setString(2, checkpoint.getNextNodeId());
                stmt.setString(3, state);
                stmt.setString(4, threadId);
                stmt.setString(5, checkpoint.getId());
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                    stmt.setString(1, threadId);
                    stmt.setString(2, checkpoint.getId());
                    stmt.setString(3, checkpoint.getNodeId());
                    stmt.setString(4, checkpoint.getNextNodeId());
                    stmt.setString(5, state);
                    stmt.executeUpdate();
                }
            }
            log.debug("Saved checkpoint '{}' for thread '{}'", checkpoint.getId(), threadId);
        }

        return RunnableConfig.builder(config)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        String threadId = resolveThreadId(config);
        Collection<Checkpoint> released = list(config);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            int deleted = stmt.executeUpdate();
            log.debug("Released {} checkpoints for thread '{}'", deleted, threadId);
        }
        return new Tag(threadId, released);
    }

    /**
     * Deletes the given checkpoints of one thread in a single transaction,
     * leaving its other checkpoints in place.
     *
     * @return number of rows deleted
     */
    public int deleteCheckpoints(String threadId, Collection<String> checkpointIds) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(DELETE_BY_ID_SQL)) {
                for (String checkpointId : checkpointIds) {
                    stmt.setString(1, threadId);
                    stmt.setString(2, checkpointId);
                    stmt.addBatch();
                }
                int deleted = Arrays.stream(stmt.executeBatch()).sum();
                conn.commit();
                log.debug("Deleted {} checkpoints of thread '{}'", deleted, threadId);
                return deleted;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        }
    }

    /**
     * Returns all distinct thread ids, i.e. every execution with a stored journal.
     */
    public List<String> listAllThreadIds() {
        List<String> threadIds = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_THREADS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                threadIds.add(rs.getString("thread_id"));
            }
        } catch (SQLException e) {
            log.error("Failed to list journal thread ids", e);
        }
        return threadIds;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String resolveThreadId(RunnableConfig config) {
        return config.threadId().orElse(THREAD_ID_DEFAULT);
    }

    private String serializeState(Map<String, Object> state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize journal state", e);
        }
    }

    private Map<String, Object> deserializeState(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize journal state", e);
        }
    }

    private Checkpoint fromResultSet(ResultSet rs) throws SQLException {
        var builder = Checkpoint.builder()
                .id(rs.getString("checkpoint_id"))
                .state(deserializeState(rs.getString("state")));

        String nodeId = rs.getString("node_id");
        if (nodeId != null) {
            builder.nodeId(nodeId);
        }
        String nextNodeId = rs.getString("next_node_id");
        if (nextNodeId != null) {
            builder.nextNodeId(nextNodeId);
        }
        return builder.build();
    }
}
