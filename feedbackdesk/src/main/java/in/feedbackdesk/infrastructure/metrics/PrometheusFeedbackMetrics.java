package in.feedbackdesk.infrastructure.metrics;

import in.feedbackdesk.domain.model.FeedbackOperation;
import in.feedbackdesk.domain.model.OperationOutcome;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of FeedbackMetrics.
 *
 * Metrics are exposed at the /metrics endpoint by {@link PrometheusMetricsHandler}.
 *
 * Key Metrics:
 * - feedback_operations_total{operation, outcome} - Operation counts
 * - feedback_operation_duration_seconds{operation} - Operation latency distribution
 * - feedback_count - Records currently stored
 * - http_requests_total{method, endpoint, status} - HTTP request counts
 * - http_request_duration_seconds{method, endpoint} - HTTP latency distribution
 * - errors_total{error_type} - Error counts
 *
 * Usage:
 * <pre>
 * PrometheusFeedbackMetrics metrics = new PrometheusFeedbackMetrics();
 * FeedbackService service = new FeedbackService(validator, repository, metrics, clock);
 *
 * // Expose at /metrics endpoint
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry(), ...));
 * </pre>
 */
public class PrometheusFeedbackMetrics implements FeedbackMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusFeedbackMetrics.class);

    private static final double[] LATENCY_BUCKETS =
        {0.001, 0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0};

    private final CollectorRegistry registry;

    // Feedback operation metrics
    private final Counter operationCounter;
    private final Histogram operationDuration;
    private final Gauge feedbackCount;

    // HTTP metrics
    private final Counter httpRequestCounter;
    private final Histogram httpRequestDuration;

    // Error metrics
    private final Counter errorCounter;

    public PrometheusFeedbackMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusFeedbackMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.operationCounter = Counter.build()
            .name("feedback_operations_total")
            .help("Total feedback operations by verb and outcome")
            .labelNames("operation", "outcome")
            .register(registry);

        this.operationDuration = Histogram.build()
            .name("feedback_operation_duration_seconds")
            .help("Feedback operation duration in seconds")
            .labelNames("operation")
            .buckets(LATENCY_BUCKETS)
            .register(registry);

        this.feedbackCount = Gauge.build()
            .name("feedback_count")
            .help("Current feedback count")
            .register(registry);

        this.httpRequestCounter = Counter.build()
            .name("http_requests_total")
            .help("Total HTTP requests")
            .labelNames("method", "endpoint", "status")
            .register(registry);

        this.httpRequestDuration = Histogram.build()
            .name("http_request_duration_seconds")
            .help("HTTP request duration in seconds")
            .labelNames("method", "endpoint")
            .buckets(LATENCY_BUCKETS)
            .register(registry);

        this.errorCounter = Counter.build()
            .name("errors_total")
            .help("Total errors")
            .labelNames("error_type")
            .register(registry);

        log.info("[PrometheusFeedbackMetrics] Initialized");
    }

    @Override
    public void recordOperation(FeedbackOperation operation, OperationOutcome outcome, Duration duration) {
        operationCounter.labels(operation.label(), outcome.label()).inc();
        operationDuration.labels(operation.label()).observe(toSeconds(duration));
    }

    @Override
    public void updateFeedbackCount(long count) {
        feedbackCount.set(count);
    }

    @Override
    public void recordHttpRequest(String method, String endpoint, int status, Duration duration) {
        httpRequestCounter.labels(method, endpoint, String.valueOf(status)).inc();
        httpRequestDuration.labels(method, endpoint).observe(toSeconds(duration));
    }

    @Override
    public void recordError(String errorType) {
        errorCounter.labels(errorType).inc();
    }

    /**
     * Current count of one operation/outcome pair.
     */
    public double getOperationCount(FeedbackOperation operation, OperationOutcome outcome) {
        return operationCounter.labels(operation.label(), outcome.label()).get();
    }

    public double getFeedbackCount() {
        return feedbackCount.get();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    private static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
