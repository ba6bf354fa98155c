package com.trellis.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trellis.core.model.Checkpoint;
import com.trellis.core.model.CheckpointPhase;
import com.trellis.core.model.ExecutionThread;
import com.trellis.core.model.ThreadStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-based {@link CheckpointStore} persisting threads and checkpoints to two tables.
 * <p>
 * Payload and metadata are stored as JSON text. Sequence allocation runs in a
 * transaction: the next sequence is read and the row inserted together, and the
 * {@code UNIQUE (thread_id, seq_no)} constraint catches concurrent writers, in which
 * case the append is retried.
 * <p>
 * Tables are created automatically via {@link #initialize()}.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    static final String THREADS_TABLE = "trellis_threads";
    static final String CHECKPOINTS_TABLE = "trellis_checkpoints";

    private static final int MAX_APPEND_ATTEMPTS = 5;
    private static final String UNIQUE_VIOLATION = "23505";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String CREATE_THREADS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                thread_id  VARCHAR(255) NOT NULL PRIMARY KEY,
                namespace  VARCHAR(255),
                status     VARCHAR(32) NOT NULL,
                metadata   TEXT,
                created_at TIMESTAMP NOT NULL,
                closed_at  TIMESTAMP
            )
            """.formatted(THREADS_TABLE);

    private static final String CREATE_CHECKPOINTS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                checkpoint_id VARCHAR(64) NOT NULL PRIMARY KEY,
                thread_id     VARCHAR(255) NOT NULL REFERENCES %s (thread_id),
                seq_no        BIGINT NOT NULL,
                phase         VARCHAR(64) NOT NULL,
                payload       TEXT NOT NULL,
                metadata      TEXT,
                superseded    BOOLEAN NOT NULL DEFAULT FALSE,
                created_at    TIMESTAMP NOT NULL,
                CONSTRAINT uq_trellis_checkpoint_seq UNIQUE (thread_id, seq_no)
            )
            """.formatted(CHECKPOINTS_TABLE, THREADS_TABLE);

    private static final String INSERT_THREAD_SQL = """
            INSERT INTO %s (thread_id, namespace, status, metadata, created_at, closed_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(THREADS_TABLE);

    private static final String SELECT_THREAD_SQL = """
            SELECT thread_id, namespace, status, metadata, created_at, closed_at
            FROM %s
            WHERE thread_id = ?
            """.formatted(THREADS_TABLE);

    private static final String SELECT_ALL_THREADS_SQL = """
            SELECT thread_id, namespace, status, metadata, created_at, closed_at
            FROM %s
            ORDER BY created_at ASC, thread_id ASC
            """.formatted(THREADS_TABLE);

    private static final String UPDATE_THREAD_STATUS_SQL = """
            UPDATE %s SET status = ?, closed_at = ? WHERE thread_id = ?
            """.formatted(THREADS_TABLE);

    private static final String SELECT_MAX_SEQ_SQL = """
            SELECT COALESCE(MAX(seq_no), 0) FROM %s WHERE thread_id = ?
            """.formatted(CHECKPOINTS_TABLE);

    private static final String INSERT_CHECKPOINT_SQL = """
            INSERT INTO %s (checkpoint_id, thread_id, seq_no, phase, payload, metadata, superseded, created_at)
            VALUES (?, ?, ?, ?, ?, ?, FALSE, ?)
            """.formatted(CHECKPOINTS_TABLE);

    private static final String CHECKPOINT_COLUMNS =
            "checkpoint_id, thread_id, seq_no, phase, payload, metadata, superseded, created_at";

    private static final String SELECT_HISTORY_SQL = """
            SELECT %s
            FROM %s
            WHERE thread_id = ? AND superseded = FALSE
            ORDER BY seq_no DESC
            LIMIT ?
            """.formatted(CHECKPOINT_COLUMNS, CHECKPOINTS_TABLE);

    private static final String SELECT_ALL_CHECKPOINTS_SQL = """
            SELECT %s
            FROM %s
            WHERE thread_id = ?
            ORDER BY seq_no ASC
            """.formatted(CHECKPOINT_COLUMNS, CHECKPOINTS_TABLE);

    private static final String SELECT_CHECKPOINT_BY_ID_SQL = """
            SELECT %s
            FROM %s
            WHERE thread_id = ? AND checkpoint_id = ?
            """.formatted(CHECKPOINT_COLUMNS, CHECKPOINTS_TABLE);

    private static final String SUPERSEDE_AFTER_SQL = """
            UPDATE %s SET superseded = TRUE
            WHERE thread_id = ? AND seq_no > ? AND superseded = FALSE
            """.formatted(CHECKPOINTS_TABLE);

    private static final String COUNT_VISIBLE_SQL = """
            SELECT COUNT(*) FROM %s WHERE thread_id = ? AND superseded = FALSE
            """.formatted(CHECKPOINTS_TABLE);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointStore(DataSource dataSource) {
        this(dataSource, new ObjectMapper());
    }

    public JdbcCheckpointStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the thread and checkpoint tables if they do not already exist.
     */
    @Override
    public void initialize() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_THREADS_SQL);
            stmt.execute(CREATE_CHECKPOINTS_SQL);
            log.info("Checkpoint tables '{}' and '{}' ensured", THREADS_TABLE, CHECKPOINTS_TABLE);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to create checkpoint tables", e);
        }
    }

    @Override
    public void insertThread(ExecutionThread thread) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_THREAD_SQL)) {
            stmt.setString(1, thread.threadId());
            stmt.setString(2, thread.namespace());
            stmt.setString(3, thread.status().name());
            stmt.setString(4, toJson(thread.metadata()));
            stmt.setTimestamp(5, Timestamp.from(thread.createdAt()));
            stmt.setTimestamp(6, thread.closedAt() != null ? Timestamp.from(thread.closedAt()) : null);
            stmt.executeUpdate();
            log.debug("Inserted thread '{}'", thread.threadId());
        } catch (SQLException e) {
            throw new PersistenceException("Failed to insert thread '" + thread.threadId() + "'", e);
        }
    }

    @Override
    public Optional<ExecutionThread> findThread(String threadId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_THREAD_SQL)) {
            stmt.setString(1, threadId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(threadFromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load thread '" + threadId + "'", e);
        }
    }

    @Override
    public List<ExecutionThread> listThreads() {
        List<ExecutionThread> threads = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_THREADS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                threads.add(threadFromResultSet(rs));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list threads", e);
        }
        return threads;
    }

    @Override
    public void updateThreadStatus(String threadId, ThreadStatus status, Instant closedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_THREAD_STATUS_SQL)) {
            stmt.setString(1, status.name());
            stmt.setTimestamp(2, closedAt != null ? Timestamp.from(closedAt) : null);
            stmt.setString(3, threadId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update thread '" + threadId + "'", e);
        }
    }

    @Override
    public Checkpoint append(String threadId, CheckpointPhase phase, Map<String, Object> payload,
                             Map<String, Object> metadata) {
        String payloadJson = toJson(payload);
        String metadataJson = toJson(metadata);
        SQLException last = null;
        for (int attempt = 1; attempt <= MAX_APPEND_ATTEMPTS; attempt++) {
            try {
                return tryAppend(threadId, phase, payload, metadata, payloadJson, metadataJson);
            } catch (SQLException e) {
                if (!UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw new PersistenceException("Failed to append checkpoint to thread '" + threadId + "'", e);
                }
                log.debug("Sequence collision on thread '{}' (attempt {}), retrying", threadId, attempt);
                last = e;
            }
        }
        throw new PersistenceException("Could not allocate a checkpoint sequence for thread '" + threadId
                + "' after " + MAX_APPEND_ATTEMPTS + " attempts", last);
    }

    private Checkpoint tryAppend(String threadId, CheckpointPhase phase, Map<String, Object> payload,
                                 Map<String, Object> metadata, String payloadJson, String metadataJson)
            throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                long next;
                try (PreparedStatement stmt = conn.prepareStatement(SELECT_MAX_SEQ_SQL)) {
                    stmt.setString(1, threadId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        rs.next();
                        next = rs.getLong(1) + 1;
                    }
                }
                String checkpointId = UUID.randomUUID().toString();
                Instant now = Instant.now();
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_CHECKPOINT_SQL)) {
                    stmt.setString(1, checkpointId);
                    stmt.setString(2, threadId);
                    stmt.setLong(3, next);
                    stmt.setString(4, phase.tag());
                    stmt.setString(5, payloadJson);
                    stmt.setString(6, metadataJson);
                    stmt.setTimestamp(7, Timestamp.from(now));
                    stmt.executeUpdate();
                }
                conn.commit();
                log.debug("Saved checkpoint '{}' (seq {}) for thread '{}'", checkpointId, next, threadId);
                return new Checkpoint(checkpointId, threadId, next, phase,
                        copy(payload), copy(metadata), false, now);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    @Override
    public Optional<Checkpoint> findLatest(String threadId) {
        List<Checkpoint> history = findHistory(threadId, 1);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(0));
    }

    @Override
    public List<Checkpoint> findHistory(String threadId, int limit) {
        return queryCheckpoints(SELECT_HISTORY_SQL, threadId, Math.max(limit, 0));
    }

    @Override
    public List<Checkpoint> findAll(String threadId) {
        return queryCheckpoints(SELECT_ALL_CHECKPOINTS_SQL, threadId, null);
    }

    @Override
    public Optional<Checkpoint> findById(String threadId, String checkpointId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CHECKPOINT_BY_ID_SQL)) {
            stmt.setString(1, threadId);
            stmt.setString(2, checkpointId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(checkpointFromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load checkpoint '" + checkpointId
                    + "' of thread '" + threadId + "'", e);
        }
    }

    @Override
    public int supersedeAfter(String threadId, long sequence) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SUPERSEDE_AFTER_SQL)) {
            stmt.setString(1, threadId);
            stmt.setLong(2, sequence);
            int marked = stmt.executeUpdate();
            log.debug("Superseded {} checkpoints after seq {} on thread '{}'", marked, sequence, threadId);
            return marked;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to revert thread '" + threadId + "'", e);
        }
    }

    @Override
    public long countCheckpoints(String threadId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_VISIBLE_SQL)) {
            stmt.setString(1, threadId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to count checkpoints of thread '" + threadId + "'", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Checkpoint database unavailable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        // the DataSource is owned by the container
    }

    // ── Mapping helpers ─────────────────────────────────────────────────

    private List<Checkpoint> queryCheckpoints(String sql, String threadId, Integer limit) {
        List<Checkpoint> checkpoints = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, threadId);
            if (limit != null) {
                stmt.setInt(2, limit);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(checkpointFromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list checkpoints for thread '" + threadId + "'", e);
        }
        return checkpoints;
    }

    private ExecutionThread threadFromResultSet(ResultSet rs) throws SQLException {
        Timestamp closedAt = rs.getTimestamp("closed_at");
        return new ExecutionThread(
                rs.getString("thread_id"),
                rs.getString("namespace"),
                fromJson(rs.getString("metadata")),
                ThreadStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(),
                closedAt != null ? closedAt.toInstant() : null);
    }

    private Checkpoint checkpointFromResultSet(ResultSet rs) throws SQLException {
        return new Checkpoint(
                rs.getString("checkpoint_id"),
                rs.getString("thread_id"),
                rs.getLong("seq_no"),
                CheckpointPhase.fromTag(rs.getString("phase")),
                fromJson(rs.getString("payload")),
                fromJson(rs.getString("metadata")),
                rs.getBoolean("superseded"),
                rs.getTimestamp("created_at").toInstant());
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value != null ? value : Map.of());
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize checkpoint data", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return Collections.unmodifiableMap(objectMapper.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize checkpoint data", e);
        }
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
