package in.feedbackdesk.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.function.LongSupplier;

/**
 * HTTP handler for the Prometheus /metrics endpoint.
 *
 * Before each scrape the feedback_count gauge is refreshed from storage. If storage is down
 * the scrape still succeeds with the last known count.
 *
 * Example output:
 * <pre>
 * # HELP feedback_operations_total Total feedback operations by verb and outcome
 * # TYPE feedback_operations_total counter
 * feedback_operations_total{operation="create",outcome="success",} 12.0
 * feedback_operations_total{operation="create",outcome="validation_error",} 2.0
 *
 * # HELP feedback_count Current feedback count
 * # TYPE feedback_count gauge
 * feedback_count 10.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;
    private final FeedbackMetrics metrics;
    private final LongSupplier feedbackCounter;

    public PrometheusMetricsHandler(CollectorRegistry registry, FeedbackMetrics metrics, LongSupplier feedbackCounter) {
        this.registry = registry;
        this.metrics = metrics;
        this.feedbackCounter = feedbackCounter;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        refreshFeedbackCount();

        try {
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);

            Writer writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());

            String metricsOutput = writer.toString();

            exchange.setStatusCode(200);
            exchange.getResponseSender().send(metricsOutput);

            log.debug("[PrometheusMetricsHandler] Served metrics ({} bytes)", metricsOutput.length());

        } catch (IOException e) {
            log.error("[PrometheusMetricsHandler] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics");
        }
    }

    private void refreshFeedbackCount() {
        try {
            metrics.updateFeedbackCount(feedbackCounter.getAsLong());
        } catch (RuntimeException e) {
            log.warn("[PrometheusMetricsHandler] Could not refresh feedback_count: {}", e.getMessage());
            metrics.recordError(e.getClass().getSimpleName());
        }
    }
}
