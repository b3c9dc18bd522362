package in.feedbackdesk.domain.exception;

/**
 * Thrown when no present record has the requested id. Deleted and never-created ids look the same.
 */
public class FeedbackNotFoundException extends FeedbackException {

    private final long feedbackId;

    public FeedbackNotFoundException(long feedbackId) {
        super("Feedback not found: " + feedbackId);
        this.feedbackId = feedbackId;
    }

    public long getFeedbackId() {
        return feedbackId;
    }
}
