package in.feedbackdesk.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.feedbackdesk.application.service.FeedbackService;
import in.feedbackdesk.infrastructure.metrics.FeedbackMetrics;
import in.feedbackdesk.infrastructure.metrics.PrometheusMetricsHandler;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.server.handlers.resource.ClassPathResourceManager;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Embedded Undertow server exposing the feedback API, health, metrics and the static UI.
 *
 * Routes:
 * - POST   /feedback
 * - GET    /feedback
 * - GET    /feedback/{id}
 * - PUT    /feedback/{id}
 * - DELETE /feedback/{id}
 * - GET    /health
 * - GET    /metrics
 * - GET    /, /static/*  (static files from classpath:static/)
 */
public final class FeedbackHttpServer {
    private static final Logger log = LoggerFactory.getLogger(FeedbackHttpServer.class);

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Undertow server;
    private final String host;
    private final int port;

    public FeedbackHttpServer(String host, int port, FeedbackService feedbackService,
                              FeedbackMetrics metrics, CollectorRegistry registry, Clock clock) {
        this.host = host;
        this.port = port;

        FeedbackHandlers api = new FeedbackHandlers(feedbackService, MAPPER);
        HealthHandler healthHandler = new HealthHandler(feedbackService, MAPPER, clock);
        PrometheusMetricsHandler metricsHandler =
            new PrometheusMetricsHandler(registry, metrics, feedbackService::countFeedback);

        HttpHandler staticFiles = Handlers.resource(
            new ClassPathResourceManager(FeedbackHttpServer.class.getClassLoader(), "static"));

        RoutingHandler routes = Handlers.routing()
            .post("/feedback", blocking("/feedback", metrics, api::create))
            .get("/feedback", blocking("/feedback", metrics, api::list))
            .get("/feedback/{id}", blocking("/feedback/:id", metrics, api::get))
            .put("/feedback/{id}", blocking("/feedback/:id", metrics, api::update))
            .delete("/feedback/{id}", blocking("/feedback/:id", metrics, api::delete))
            .get("/health", blocking("/health", metrics, healthHandler::health))
            .get("/metrics", metricsHandler)
            .setFallbackHandler(staticFiles);

        // /static/* serves the same files as /, with the prefix stripped
        HttpHandler app = Handlers.path(routes).addPrefixPath("/static", staticFiles);

        // CORS Handler
        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                app.handleRequest(exchange);
            }
        };

        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(corsHandler)
            .build();
    }

    private static HttpHandler blocking(String endpoint, FeedbackMetrics metrics, HttpHandler handler) {
        return new RequestMetricsHandler(endpoint, metrics, new BlockingHandler(handler));
    }

    public void start() {
        server.start();
        log.info("[HTTP] Feedback API listening on http://{}:{}/", host, port);
    }

    public void stop() {
        server.stop();
        log.info("[HTTP] Feedback API stopped");
    }
}
