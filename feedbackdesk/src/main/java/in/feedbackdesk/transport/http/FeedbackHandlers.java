package in.feedbackdesk.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.feedbackdesk.application.service.FeedbackService;
import in.feedbackdesk.domain.exception.FeedbackNotFoundException;
import in.feedbackdesk.domain.exception.FeedbackValidationException;
import in.feedbackdesk.domain.exception.StorageUnavailableException;
import in.feedbackdesk.domain.model.FeedbackRecord;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.OptionalLong;

/**
 * HTTP handlers for the /feedback resource.
 *
 * Handlers run on worker threads (routes are wrapped in a BlockingHandler), so they may
 * block on storage and read the request body as a stream.
 */
public final class FeedbackHandlers {
    private static final Logger log = LoggerFactory.getLogger(FeedbackHandlers.class);

    // JSON Response Keys
    static final String JSON_ERROR = "error";
    static final String JSON_KIND = "kind";
    static final String JSON_MESSAGE = "message";
    static final String JSON_ID = "id";

    // Client-facing messages
    static final String ERROR_NOT_FOUND = "Feedback not found";
    static final String ERROR_UNAVAILABLE = "Service unavailable";
    static final String ERROR_INTERNAL = "Internal server error";
    static final String ERROR_MALFORMED_JSON = "Request body must be valid JSON";
    static final String KIND_MALFORMED_JSON = "MalformedJson";
    static final String SUCCESS_DELETED = "Feedback deleted successfully";

    private final FeedbackService feedbackService;
    private final ObjectMapper mapper;

    public FeedbackHandlers(FeedbackService feedbackService, ObjectMapper mapper) {
        this.feedbackService = feedbackService;
        this.mapper = mapper;
    }

    /**
     * POST /feedback - Create feedback.
     */
    public void create(HttpServerExchange exchange) {
        try {
            JsonNode body = readBody(exchange);
            FeedbackRecord created = feedbackService.createFeedback(body);
            sendJson(exchange, StatusCodes.CREATED, created);
        } catch (Exception e) {
            handleFailure(exchange, "create", e);
        }
    }

    /**
     * GET /feedback - List all feedback, id ascending.
     */
    public void list(HttpServerExchange exchange) {
        try {
            List<FeedbackRecord> records = feedbackService.listFeedback();
            sendJson(exchange, StatusCodes.OK, records);
        } catch (Exception e) {
            handleFailure(exchange, "list", e);
        }
    }

    /**
     * GET /feedback/{id} - Get one feedback record.
     */
    public void get(HttpServerExchange exchange) {
        OptionalLong id = pathId(exchange);
        if (id.isEmpty()) {
            sendError(exchange, StatusCodes.NOT_FOUND, ERROR_NOT_FOUND, null);
            return;
        }

        try {
            FeedbackRecord record = feedbackService.getFeedback(id.getAsLong());
            sendJson(exchange, StatusCodes.OK, record);
        } catch (Exception e) {
            handleFailure(exchange, "get", e);
        }
    }

    /**
     * PUT /feedback/{id} - Replace the message of one feedback record.
     */
    public void update(HttpServerExchange exchange) {
        OptionalLong id = pathId(exchange);
        if (id.isEmpty()) {
            sendError(exchange, StatusCodes.NOT_FOUND, ERROR_NOT_FOUND, null);
            return;
        }

        try {
            JsonNode body = readBody(exchange);
            FeedbackRecord updated = feedbackService.updateFeedback(id.getAsLong(), body);
            sendJson(exchange, StatusCodes.OK, updated);
        } catch (Exception e) {
            handleFailure(exchange, "update", e);
        }
    }

    /**
     * DELETE /feedback/{id} - Delete one feedback record.
     */
    public void delete(HttpServerExchange exchange) {
        OptionalLong id = pathId(exchange);
        if (id.isEmpty()) {
            sendError(exchange, StatusCodes.NOT_FOUND, ERROR_NOT_FOUND, null);
            return;
        }

        try {
            feedbackService.deleteFeedback(id.getAsLong());

            ObjectNode response = mapper.createObjectNode();
            response.put(JSON_MESSAGE, SUCCESS_DELETED);
            response.put(JSON_ID, id.getAsLong());
            sendJson(exchange, StatusCodes.OK, response);
        } catch (Exception e) {
            handleFailure(exchange, "delete", e);
        }
    }

    // ============================================================

    private JsonNode readBody(HttpServerExchange exchange) throws IOException {
        try (InputStream in = exchange.getInputStream()) {
            return mapper.readTree(in);
        }
    }

    private OptionalLong pathId(HttpServerExchange exchange) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        String raw = match == null ? null : match.getParameters().get("id");
        if (raw == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private void handleFailure(HttpServerExchange exchange, String action, Exception e) {
        if (e instanceof FeedbackValidationException ve) {
            sendError(exchange, StatusCodes.BAD_REQUEST, ve.getMessage(), ve.getKind().wireName());
        } else if (e instanceof FeedbackNotFoundException) {
            sendError(exchange, StatusCodes.NOT_FOUND, ERROR_NOT_FOUND, null);
        } else if (e instanceof StorageUnavailableException) {
            sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, ERROR_UNAVAILABLE, null);
        } else if (e instanceof JsonProcessingException) {
            sendError(exchange, StatusCodes.BAD_REQUEST, ERROR_MALFORMED_JSON, KIND_MALFORMED_JSON);
        } else {
            log.error("[HTTP] Error handling {} feedback: {}", action, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, ERROR_INTERNAL, null);
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Object body) throws JsonProcessingException {
        String json = mapper.writeValueAsString(body);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int status, String message, String kind) {
        ObjectNode response = mapper.createObjectNode();
        response.put(JSON_ERROR, message);
        if (kind != null) {
            response.put(JSON_KIND, kind);
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(response.toString(), StandardCharsets.UTF_8);
    }
}
