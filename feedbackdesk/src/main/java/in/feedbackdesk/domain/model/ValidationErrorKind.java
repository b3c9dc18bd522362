package in.feedbackdesk.domain.model;

/**
 * Why a feedback payload was rejected. The wire name is what clients see in the "kind" field.
 */
public enum ValidationErrorKind {
    MISSING_FIELD("MissingField"),
    INVALID_TYPE("InvalidType"),
    EMPTY_MESSAGE("EmptyMessage"),
    TOO_LONG("TooLong");

    private final String wireName;

    ValidationErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
