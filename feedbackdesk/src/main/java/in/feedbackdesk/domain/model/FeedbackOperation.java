package in.feedbackdesk.domain.model;

/**
 * Feedback verbs as they appear in the "operation" metric label.
 */
public enum FeedbackOperation {
    CREATE("create"),
    READ("read"),
    LIST("list"),
    UPDATE("update"),
    DELETE("delete");

    private final String label;

    FeedbackOperation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
