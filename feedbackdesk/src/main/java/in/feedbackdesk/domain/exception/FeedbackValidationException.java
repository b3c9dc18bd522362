package in.feedbackdesk.domain.exception;

import in.feedbackdesk.domain.model.ValidationErrorKind;

/**
 * Thrown when a feedback payload fails validation. The message is safe to show to clients.
 */
public class FeedbackValidationException extends FeedbackException {

    private final ValidationErrorKind kind;

    public FeedbackValidationException(ValidationErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ValidationErrorKind getKind() {
        return kind;
    }
}
