package in.feedbackdesk.application.port.output;

import in.feedbackdesk.domain.model.FeedbackRecord;
import in.feedbackdesk.domain.model.ValidatedMessage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for feedback records. Every method may throw
 * {@link in.feedbackdesk.domain.exception.StorageUnavailableException}.
 */
public interface FeedbackRepository {
    FeedbackRecord create(ValidatedMessage message, Instant now);

    Optional<FeedbackRecord> findById(long id);

    /**
     * All present records, ordered by id ascending.
     */
    List<FeedbackRecord> findAll();

    /**
     * Replace the message and advance updated_at. Empty if no record has this id.
     */
    Optional<FeedbackRecord> update(long id, ValidatedMessage message, Instant now);

    boolean delete(long id);

    long count();
}
