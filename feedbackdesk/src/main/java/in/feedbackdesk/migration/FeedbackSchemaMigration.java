package in.feedbackdesk.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Feedback schema migration, run on startup.
 *
 * Creates the feedback table when it is missing and leaves an existing one untouched.
 * Never drops or rewrites data, so running it on every start is safe.
 */
public final class FeedbackSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(FeedbackSchemaMigration.class);

    public static final String TABLE = "feedback";

    private final DataSource dataSource;

    public FeedbackSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create the feedback table if it does not exist.
     */
    public void migrate() {
        log.info("[MIGRATION] Checking feedback schema");

        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, TABLE)) {
                log.info("[MIGRATION] {} table already exists", TABLE);
                return;
            }

            log.info("[MIGRATION] Creating {} table...", TABLE);
            createFeedbackTable(conn);
            log.info("[MIGRATION] ✓ {} table created", TABLE);

        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Feedback schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createFeedbackTable(Connection conn) throws SQLException {
        // AUTOINCREMENT keeps SQLite from handing out the id of a deleted row again.
        String sql = """
            CREATE TABLE IF NOT EXISTS feedback (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                message TEXT NOT NULL,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
