package in.feedbackdesk.infrastructure.persistence;

import in.feedbackdesk.domain.exception.StorageUnavailableException;
import in.feedbackdesk.domain.model.FeedbackRecord;
import in.feedbackdesk.domain.model.ValidatedMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Transaction and statement handling of SqliteFeedbackRepository against mocked JDBC objects.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SQLite Feedback Repository JDBC Handling Tests")
public class SqliteFeedbackRepositoryJdbcTest {

    private static final Instant NOW = Instant.parse("2026-10-17T09:30:00Z");

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection conn;

    @Mock
    private PreparedStatement ps;

    @Mock
    private ResultSet rs;

    private SqliteFeedbackRepository repository;

    @BeforeEach
    public void setUp() throws SQLException {
        // 1500 ms rounds up to a 2 second query timeout
        repository = new SqliteFeedbackRepository(dataSource, Duration.ofSeconds(1), Duration.ofMillis(1500));
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
    }

    @Test
    @DisplayName("Count sets the query timeout")
    public void testCountUsesQueryTimeout() throws SQLException {
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getLong(1)).thenReturn(3L);

        assertEquals(3L, repository.count());
        verify(ps).setQueryTimeout(2);
    }

    @Test
    @DisplayName("Committed create is returned even if restoring auto-commit fails")
    public void testAutoCommitResetFailureAfterCommit() throws SQLException {
        when(ps.executeUpdate()).thenReturn(1);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getLong(1)).thenReturn(42L);
        // setAutoCommit(false) opens the transaction; only the reset afterwards fails
        lenient().doThrow(new SQLException("connection reset")).when(conn).setAutoCommit(true);

        FeedbackRecord created = repository.create(new ValidatedMessage("kept"), NOW);

        assertEquals(42L, created.id());
        verify(conn).commit();
        verify(conn, never()).rollback();
        assertFalse(repository.writeLock().isLocked());
    }

    @Test
    @DisplayName("Failed statement rolls back and releases the write path")
    public void testFailedWriteRollsBack() throws SQLException {
        when(ps.executeUpdate()).thenThrow(new SQLException("disk I/O error"));

        StorageUnavailableException e = assertThrows(StorageUnavailableException.class,
            () -> repository.delete(5));

        assertEquals("delete", e.getOperation());
        verify(conn).rollback();
        verify(conn, never()).commit();
        verify(conn).close();
        assertFalse(repository.writeLock().isLocked());
    }
}
