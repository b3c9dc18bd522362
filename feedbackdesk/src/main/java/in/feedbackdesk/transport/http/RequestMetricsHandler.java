package in.feedbackdesk.transport.http;

import in.feedbackdesk.infrastructure.metrics.FeedbackMetrics;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Wraps one route and records http_requests_total / http_request_duration_seconds when the
 * exchange completes, labelled with the route template rather than the raw path.
 */
public final class RequestMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(RequestMetricsHandler.class);

    private final String endpoint;
    private final FeedbackMetrics metrics;
    private final HttpHandler next;

    public RequestMetricsHandler(String endpoint, FeedbackMetrics metrics, HttpHandler next) {
        this.endpoint = endpoint;
        this.metrics = metrics;
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        long start = System.nanoTime();
        String method = exchange.getRequestMethod().toString();

        exchange.addExchangeCompleteListener((ex, nextListener) -> {
            try {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                int status = ex.getStatusCode();
                metrics.recordHttpRequest(method, endpoint, status, elapsed);
                log.info("[HTTP] {} {} -> {} ({} ms)", method, ex.getRequestPath(), status, elapsed.toMillis());
            } finally {
                nextListener.proceed();
            }
        });

        next.handleRequest(exchange);
    }
}
