package in.feedbackdesk.infrastructure.persistence;

import in.feedbackdesk.application.port.output.FeedbackRepository;
import in.feedbackdesk.domain.exception.StorageUnavailableException;
import in.feedbackdesk.domain.model.FeedbackRecord;
import in.feedbackdesk.domain.model.ValidatedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed feedback store.
 *
 * SQLite allows one writer at a time. Instead of letting concurrent writers race for the
 * file lock and fail with SQLITE_BUSY, every mutation goes through {@code writeLock}:
 * - create/update/delete acquire it with a bounded wait (writeLockTimeout)
 * - each mutation is a single transaction, committed or rolled back as a whole
 * - reads take no lock; WAL mode gives them the last committed state
 *
 * Timestamps are stored as ISO-8601 text, truncated to microseconds.
 */
public final class SqliteFeedbackRepository implements FeedbackRepository {
    private static final Logger log = LoggerFactory.getLogger(SqliteFeedbackRepository.class);

    private static final String SELECT_COLUMNS = "SELECT id, message, created_at, updated_at FROM feedback";

    private final DataSource dataSource;
    private final Duration writeLockTimeout;
    private final int queryTimeoutSeconds;
    private final ReentrantLock writeLock = new ReentrantLock(true);

    public SqliteFeedbackRepository(DataSource dataSource, Duration writeLockTimeout, Duration statementTimeout) {
        this.dataSource = dataSource;
        this.writeLockTimeout = writeLockTimeout;
        this.queryTimeoutSeconds = (int) Math.max(1, (statementTimeout.toMillis() + 999) / 1000);
    }

    @Override
    public FeedbackRecord create(ValidatedMessage message, Instant now) {
        Instant createdAt = now.truncatedTo(ChronoUnit.MICROS);
        String insertSql = "INSERT INTO feedback (message, created_at, updated_at) VALUES (?, ?, ?)";

        return withWriteLock("create", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setQueryTimeout(queryTimeoutSeconds);
                ps.setString(1, message.text());
                ps.setString(2, createdAt.toString());
                ps.setString(3, createdAt.toString());
                ps.executeUpdate();
            }

            long id;
            try (PreparedStatement ps = conn.prepareStatement("SELECT last_insert_rowid()");
                 ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("No rowid returned for inserted feedback");
                }
                id = rs.getLong(1);
            }

            log.info("[STORAGE] Feedback inserted: id={}", id);
            return new FeedbackRecord(id, message.text(), createdAt, createdAt);
        });
    }

    @Override
    public Optional<FeedbackRecord> findById(long id) {
        String sql = SELECT_COLUMNS + " WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setLong(1, id);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            log.error("[STORAGE] Error finding feedback by id={}: {}", id, e.getMessage(), e);
            throw new StorageUnavailableException("findById", "Failed to read feedback", e);
        }
    }

    @Override
    public List<FeedbackRecord> findAll() {
        String sql = SELECT_COLUMNS + " ORDER BY id ASC";
        List<FeedbackRecord> records = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
            return records;

        } catch (SQLException e) {
            log.error("[STORAGE] Error listing feedback: {}", e.getMessage(), e);
            throw new StorageUnavailableException("findAll", "Failed to list feedback", e);
        }
    }

    @Override
    public Optional<FeedbackRecord> update(long id, ValidatedMessage message, Instant now) {
        String selectSql = SELECT_COLUMNS + " WHERE id = ?";
        String updateSql = "UPDATE feedback SET message = ?, updated_at = ? WHERE id = ?";

        return withWriteLock("update", conn -> {
            FeedbackRecord current;
            try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                ps.setQueryTimeout(queryTimeoutSeconds);
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    current = mapRow(rs);
                }
            }

            Instant updatedAt = nextUpdatedAt(current.updatedAt(), now);

            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                ps.setQueryTimeout(queryTimeoutSeconds);
                ps.setString(1, message.text());
                ps.setString(2, updatedAt.toString());
                ps.setLong(3, id);
                int updated = ps.executeUpdate();
                if (updated != 1) {
                    throw new SQLException("Expected 1 updated row for id=" + id + ", got " + updated);
                }
            }

            log.info("[STORAGE] Feedback updated: id={}", id);
            return Optional.of(current.withMessage(message.text(), updatedAt));
        });
    }

    @Override
    public boolean delete(long id) {
        String sql = "DELETE FROM feedback WHERE id = ?";

        return withWriteLock("delete", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setQueryTimeout(queryTimeoutSeconds);
                ps.setLong(1, id);
                boolean deleted = ps.executeUpdate() > 0;
                if (deleted) {
                    log.info("[STORAGE] Feedback deleted: id={}", id);
                }
                return deleted;
            }
        });
    }

    @Override
    public long count() {
        String sql = "SELECT COUNT(*) FROM feedback";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);

            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }

        } catch (SQLException e) {
            log.error("[STORAGE] Error counting feedback: {}", e.getMessage(), e);
            throw new StorageUnavailableException("count", "Failed to count feedback", e);
        }
    }

    /**
     * updated_at must move strictly forward even when the clock has not advanced
     * (or has stepped back) since the previous write.
     */
    static Instant nextUpdatedAt(Instant previous, Instant now) {
        Instant candidate = now.truncatedTo(ChronoUnit.MICROS);
        if (candidate.isAfter(previous)) {
            return candidate;
        }
        return previous.plus(1, ChronoUnit.MICROS);
    }

    /**
     * Run one mutation on the single write path, inside one transaction.
     */
    private <T> T withWriteLock(String operation, SqlWork<T> work) {
        boolean acquired;
        try {
            acquired = writeLock.tryLock(writeLockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException(operation, "Interrupted while waiting for write path", e);
        }
        if (!acquired) {
            log.warn("[STORAGE] Write path busy for {} ms, giving up on {}", writeLockTimeout.toMillis(), operation);
            throw new StorageUnavailableException(operation, "Timed out waiting for write path");
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, operation);
                throw e;
            } finally {
                restoreAutoCommit(conn, operation);
            }
        } catch (SQLException e) {
            log.error("[STORAGE] {} failed: {}", operation, e.getMessage(), e);
            throw new StorageUnavailableException(operation, "Failed to write feedback", e);
        } finally {
            writeLock.unlock();
        }
    }

    private void rollbackQuietly(Connection conn, String operation) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            log.error("[STORAGE] Rollback failed for {}: {}", operation, rollbackError.getMessage(), rollbackError);
        }
    }

    // The transaction has already ended here; a failed reset must not change the result.
    private void restoreAutoCommit(Connection conn, String operation) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException resetError) {
            log.warn("[STORAGE] Could not restore auto-commit after {}: {}", operation, resetError.getMessage(), resetError);
        }
    }

    ReentrantLock writeLock() {
        return writeLock;
    }

    private FeedbackRecord mapRow(ResultSet rs) throws SQLException {
        return new FeedbackRecord(
            rs.getLong("id"),
            rs.getString("message"),
            Instant.parse(rs.getString("created_at")),
            Instant.parse(rs.getString("updated_at"))
        );
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }
}
