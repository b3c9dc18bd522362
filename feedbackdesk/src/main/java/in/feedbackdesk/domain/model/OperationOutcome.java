package in.feedbackdesk.domain.model;

/**
 * Outcome category recorded for every feedback operation.
 */
public enum OperationOutcome {
    SUCCESS("success"),
    VALIDATION_ERROR("validation_error"),
    NOT_FOUND("not_found"),
    STORAGE_ERROR("storage_error");

    private final String label;

    OperationOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
