package in.feedbackdesk.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A stored feedback entry.
 *
 * id and createdAt never change after creation; updatedAt moves forward on every update.
 */
public record FeedbackRecord(
    @JsonProperty("id")
    long id,

    @JsonProperty("message")
    String message,

    @JsonProperty("created_at")
    Instant createdAt,

    @JsonProperty("updated_at")
    Instant updatedAt
) {
    public FeedbackRecord withMessage(String newMessage, Instant newUpdatedAt) {
        return new FeedbackRecord(id, newMessage, createdAt, newUpdatedAt);
    }
}
