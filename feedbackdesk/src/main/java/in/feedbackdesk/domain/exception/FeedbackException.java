package in.feedbackdesk.domain.exception;

/**
 * Base type for the failures the feedback core reports to its callers.
 */
public abstract class FeedbackException extends RuntimeException {

    protected FeedbackException(String message) {
        super(message);
    }

    protected FeedbackException(String message, Throwable cause) {
        super(message, cause);
    }
}
