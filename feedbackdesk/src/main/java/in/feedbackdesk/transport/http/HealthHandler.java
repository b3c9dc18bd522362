package in.feedbackdesk.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.feedbackdesk.application.service.FeedbackService;
import in.feedbackdesk.domain.exception.StorageUnavailableException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /health
 *
 * 200 with the current record count when storage answers, 503 otherwise.
 */
public final class HealthHandler {
    private static final Logger log = LoggerFactory.getLogger(HealthHandler.class);

    private final FeedbackService feedbackService;
    private final ObjectMapper mapper;
    private final Clock clock;

    public HealthHandler(FeedbackService feedbackService, ObjectMapper mapper, Clock clock) {
        this.feedbackService = feedbackService;
        this.mapper = mapper;
        this.clock = clock;
    }

    public void health(HttpServerExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        int status;

        try {
            long count = feedbackService.countFeedback();
            body.put("status", "healthy");
            body.put("timestamp", Instant.now(clock).toString());
            body.put("feedback_count", count);
            status = StatusCodes.OK;
            log.debug("[HTTP] Health check performed: feedback_count={}", count);

        } catch (StorageUnavailableException e) {
            body.put("status", "unhealthy");
            body.put("error", FeedbackHandlers.ERROR_UNAVAILABLE);
            status = StatusCodes.SERVICE_UNAVAILABLE;
            log.error("[HTTP] Health check failed: {}", e.getMessage());
        }

        try {
            String json = mapper.writeValueAsString(body);
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("[HTTP] Failed to write health response: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send(FeedbackHandlers.ERROR_INTERNAL, StandardCharsets.UTF_8);
        }
    }
}
