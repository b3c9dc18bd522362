package in.feedbackdesk.config;

import in.feedbackdesk.util.Env;

import java.time.Duration;

/**
 * Runtime configuration for the feedback service.
 *
 * Log level and log destination (LOG_LEVEL, LOG_FILE) are read by logback.xml directly
 * and are not part of this record.
 */
public record FeedbackConfig(
    String databasePath,           // SQLite file, created on first start
    String host,                   // bind host
    int port,                      // bind port
    int maxMessageLength,          // max trimmed message length
    int dbPoolSize,                // Hikari pool size
    Duration busyTimeout,          // SQLite busy_timeout and statement timeout
    Duration writeLockTimeout      // max wait for the serialized write path
) {
    public static final String DEFAULT_DATABASE_PATH = "data/feedback.db";
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8090;
    public static final int DEFAULT_MAX_MESSAGE_LENGTH = 500;
    public static final int DEFAULT_DB_POOL_SIZE = 4;
    public static final long DEFAULT_BUSY_TIMEOUT_MS = 5000;
    public static final long DEFAULT_WRITE_LOCK_TIMEOUT_MS = 5000;

    /**
     * Load configuration from the environment (or system properties).
     */
    public static FeedbackConfig fromEnv() {
        return new FeedbackConfig(
            Env.get("DATABASE_PATH", DEFAULT_DATABASE_PATH),
            Env.get("HOST", DEFAULT_HOST),
            Env.getInt("PORT", DEFAULT_PORT),
            Env.getInt("FEEDBACK_MAX_LENGTH", DEFAULT_MAX_MESSAGE_LENGTH),
            Env.getInt("DB_POOL_SIZE", DEFAULT_DB_POOL_SIZE),
            Duration.ofMillis(Env.getLong("DB_BUSY_TIMEOUT_MS", DEFAULT_BUSY_TIMEOUT_MS)),
            Duration.ofMillis(Env.getLong("WRITE_LOCK_TIMEOUT_MS", DEFAULT_WRITE_LOCK_TIMEOUT_MS))
        );
    }

    /**
     * Defaults with a caller-supplied database file, used by tests and tools.
     */
    public static FeedbackConfig defaults(String databasePath) {
        return new FeedbackConfig(
            databasePath,
            DEFAULT_HOST,
            DEFAULT_PORT,
            DEFAULT_MAX_MESSAGE_LENGTH,
            DEFAULT_DB_POOL_SIZE,
            Duration.ofMillis(DEFAULT_BUSY_TIMEOUT_MS),
            Duration.ofMillis(DEFAULT_WRITE_LOCK_TIMEOUT_MS)
        );
    }

    public FeedbackConfig withPort(int newPort) {
        return new FeedbackConfig(databasePath, host, newPort, maxMessageLength, dbPoolSize,
            busyTimeout, writeLockTimeout);
    }
}
