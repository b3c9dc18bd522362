package in.feedbackdesk.infrastructure.persistence;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.feedbackdesk.config.FeedbackConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the pooled handle to the SQLite file.
 *
 * The pool is opened once at startup, injected into the repository and the schema migration,
 * and closed by the shutdown hook.
 */
public final class SqliteDataSourceFactory {
    private static final Logger log = LoggerFactory.getLogger(SqliteDataSourceFactory.class);

    public static HikariDataSource create(FeedbackConfig config) {
        Path dbFile = Path.of(config.databasePath()).toAbsolutePath();
        ensureParentDirectory(dbFile);

        long busyTimeoutMs = config.busyTimeout().toMillis();

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl("jdbc:sqlite:" + dbFile);
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(Math.max(250, busyTimeoutMs));
        hikari.setPoolName("feedback-sqlite");

        // Passed straight to the sqlite-jdbc driver as connection pragmas.
        hikari.addDataSourceProperty("journal_mode", "WAL");
        hikari.addDataSourceProperty("synchronous", "NORMAL");
        hikari.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeoutMs));
        hikari.addDataSourceProperty("transaction_mode", "IMMEDIATE");

        log.info("[STORAGE] DB: file={}, pool={}, busyTimeoutMs={}", dbFile, config.dbPoolSize(), busyTimeoutMs);
        return new HikariDataSource(hikari);
    }

    private static void ensureParentDirectory(Path dbFile) {
        Path parent = dbFile.getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
            log.info("[STORAGE] Created data directory {}", parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create data directory " + parent, e);
        }
    }

    private SqliteDataSourceFactory() {}
}
