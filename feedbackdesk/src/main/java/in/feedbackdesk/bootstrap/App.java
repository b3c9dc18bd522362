package in.feedbackdesk.bootstrap;

import com.zaxxer.hikari.HikariDataSource;
import in.feedbackdesk.application.service.FeedbackService;
import in.feedbackdesk.config.FeedbackConfig;
import in.feedbackdesk.infrastructure.metrics.PrometheusFeedbackMetrics;
import in.feedbackdesk.infrastructure.persistence.SqliteDataSourceFactory;
import in.feedbackdesk.infrastructure.persistence.SqliteFeedbackRepository;
import in.feedbackdesk.migration.FeedbackSchemaMigration;
import in.feedbackdesk.security.FeedbackInputValidator;
import in.feedbackdesk.transport.http.FeedbackHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires config → SQLite pool → schema migration → repository → service → Undertow,
 * and releases the server and the pool from a shutdown hook.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== feedbackdesk Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        FeedbackConfig config = FeedbackConfig.fromEnv();

        // ═══════════════════════════════════════════════════════════════
        // ✅ STARTUP VALIDATION GATE
        // ═══════════════════════════════════════════════════════════════
        try {
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
        }

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = SqliteDataSourceFactory.create(config);
        new FeedbackSchemaMigration(dataSource).migrate();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusFeedbackMetrics metrics = new PrometheusFeedbackMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Core: validator + storage + resource manager
        // ═══════════════════════════════════════════════════════════════
        Clock clock = Clock.systemUTC();
        SqliteFeedbackRepository repository =
            new SqliteFeedbackRepository(dataSource, config.writeLockTimeout(), config.busyTimeout());
        FeedbackInputValidator validator = new FeedbackInputValidator(config.maxMessageLength());
        FeedbackService feedbackService = new FeedbackService(validator, repository, metrics, clock);

        metrics.updateFeedbackCount(feedbackService.countFeedback());

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        FeedbackHttpServer server = new FeedbackHttpServer(
            config.host(), config.port(), feedbackService, metrics, metrics.getRegistry(), clock);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[SHUTDOWN] Stopping HTTP server and closing database pool");
            server.stop();
            dataSource.close();
            log.info("[SHUTDOWN] ✓ Shutdown complete");
        }, "feedbackdesk-shutdown"));

        server.start();
        log.info("✓ feedbackdesk started on http://{}:{}/", config.host(), config.port());
    }

    private App() {}
}
