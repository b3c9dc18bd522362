package in.feedbackdesk.domain.exception;

/**
 * Thrown when the store cannot be reached, a statement fails, or the write path
 * could not be acquired in time. Any mutation that raised it was rolled back.
 */
public class StorageUnavailableException extends FeedbackException {

    private final String operation;

    public StorageUnavailableException(String operation, String message) {
        super(String.format("[%s] %s", operation, message));
        this.operation = operation;
    }

    public StorageUnavailableException(String operation, String message, Throwable cause) {
        super(String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
