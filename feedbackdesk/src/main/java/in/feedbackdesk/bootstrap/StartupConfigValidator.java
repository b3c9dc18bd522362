package in.feedbackdesk.bootstrap;

import in.feedbackdesk.config.FeedbackConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before any component is built. Collects every violation and throws one
 * IllegalStateException listing all of them, so the service refuses to start on bad config.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * Validate configuration at startup.
     *
     * @param config loaded configuration
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(FeedbackConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("[STARTUP] Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> violations = new ArrayList<>();

        if (config.databasePath() == null || config.databasePath().isBlank()) {
            violations.add("DATABASE_PATH must not be blank");
        }
        if (config.host() == null || config.host().isBlank()) {
            violations.add("HOST must not be blank");
        }
        if (config.port() < 1 || config.port() > 65535) {
            violations.add("PORT must be between 1 and 65535, got " + config.port());
        }
        if (config.maxMessageLength() <= 0) {
            violations.add("FEEDBACK_MAX_LENGTH must be positive, got " + config.maxMessageLength());
        }
        if (config.dbPoolSize() < 1) {
            violations.add("DB_POOL_SIZE must be at least 1, got " + config.dbPoolSize());
        }
        if (config.busyTimeout().isZero() || config.busyTimeout().isNegative()) {
            violations.add("DB_BUSY_TIMEOUT_MS must be positive, got " + config.busyTimeout().toMillis());
        }
        if (config.writeLockTimeout().isZero() || config.writeLockTimeout().isNegative()) {
            violations.add("WRITE_LOCK_TIMEOUT_MS must be positive, got " + config.writeLockTimeout().toMillis());
        }

        if (!violations.isEmpty()) {
            StringBuilder message = new StringBuilder("❌ STARTUP BLOCKED: invalid configuration\n");
            for (String violation : violations) {
                message.append("  - ").append(violation).append('\n');
            }
            throw new IllegalStateException(message.toString());
        }

        log.info("[STARTUP] db={}, bind={}:{}, maxLength={}, pool={}, busyTimeoutMs={}, writeLockTimeoutMs={}",
            config.databasePath(), config.host(), config.port(), config.maxMessageLength(),
            config.dbPoolSize(), config.busyTimeout().toMillis(), config.writeLockTimeout().toMillis());
        log.info("[STARTUP] ✅ Startup config validation passed");
    }

    private StartupConfigValidator() {}
}
