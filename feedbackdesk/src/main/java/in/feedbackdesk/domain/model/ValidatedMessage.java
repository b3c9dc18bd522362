package in.feedbackdesk.domain.model;

/**
 * A feedback message that has passed validation. Holds the trimmed text.
 */
public record ValidatedMessage(String text) {
    public ValidatedMessage {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("ValidatedMessage text must not be empty");
        }
    }
}
