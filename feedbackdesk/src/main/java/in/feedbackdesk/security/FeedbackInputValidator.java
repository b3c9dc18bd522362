package in.feedbackdesk.security;

import com.fasterxml.jackson.databind.JsonNode;
import in.feedbackdesk.domain.exception.FeedbackValidationException;
import in.feedbackdesk.domain.model.ValidatedMessage;
import in.feedbackdesk.domain.model.ValidationErrorKind;

import java.util.regex.Pattern;

/**
 * Input validator for feedback payloads.
 *
 * Turns a parsed request body into a {@link ValidatedMessage} before any storage call.
 * Pure: no I/O, no state beyond the configured maximum length.
 *
 * Usage:
 * <pre>
 * FeedbackInputValidator validator = new FeedbackInputValidator(500);
 *
 * ValidatedMessage msg = validator.validate(MAPPER.readTree(body));  // Throws if invalid
 * repository.create(msg, Instant.now(clock));
 * </pre>
 *
 * Validation Rules (checked in this order):
 * - Payload must be a JSON object with a "message" field (null counts as absent) → MissingField
 * - "message" must be a JSON string → InvalidType
 * - Trimmed message must not be empty → EmptyMessage
 * - Trimmed length must be <= maxLength → TooLong
 */
public class FeedbackInputValidator {

    public static final String MESSAGE_FIELD = "message";

    // Unicode White_Space at either end, including no-break spaces that String.strip() keeps.
    private static final Pattern SURROUNDING_WHITESPACE =
        Pattern.compile("^\\p{IsWhite_Space}+|\\p{IsWhite_Space}+$");

    private final int maxLength;

    public FeedbackInputValidator(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    /**
     * Validate a feedback payload.
     *
     * @param payload Parsed request body (may be null or a non-object node)
     * @return the trimmed message
     * @throws FeedbackValidationException with the failing {@link ValidationErrorKind}
     */
    public ValidatedMessage validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new FeedbackValidationException(ValidationErrorKind.MISSING_FIELD,
                "Request body must be a JSON object with a message field");
        }

        JsonNode field = payload.get(MESSAGE_FIELD);
        if (field == null || field.isNull()) {
            throw new FeedbackValidationException(ValidationErrorKind.MISSING_FIELD,
                "Message field is required");
        }

        if (!field.isTextual()) {
            throw new FeedbackValidationException(ValidationErrorKind.INVALID_TYPE,
                "Message must be a string");
        }

        String message = trim(field.textValue());
        if (message.isEmpty()) {
            throw new FeedbackValidationException(ValidationErrorKind.EMPTY_MESSAGE,
                "Message cannot be empty");
        }

        // Length is counted in code points so emoji count as one character.
        int length = message.codePointCount(0, message.length());
        if (length > maxLength) {
            throw new FeedbackValidationException(ValidationErrorKind.TOO_LONG,
                "Message cannot exceed " + maxLength + " characters");
        }

        return new ValidatedMessage(message);
    }

    static String trim(String raw) {
        return SURROUNDING_WHITESPACE.matcher(raw).replaceAll("");
    }

    public int getMaxLength() {
        return maxLength;
    }
}
