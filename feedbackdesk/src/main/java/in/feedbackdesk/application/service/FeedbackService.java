package in.feedbackdesk.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.feedbackdesk.application.port.output.FeedbackRepository;
import in.feedbackdesk.domain.exception.FeedbackNotFoundException;
import in.feedbackdesk.domain.exception.FeedbackValidationException;
import in.feedbackdesk.domain.exception.StorageUnavailableException;
import in.feedbackdesk.domain.model.FeedbackOperation;
import in.feedbackdesk.domain.model.FeedbackRecord;
import in.feedbackdesk.domain.model.OperationOutcome;
import in.feedbackdesk.domain.model.ValidatedMessage;
import in.feedbackdesk.infrastructure.metrics.FeedbackMetrics;
import in.feedbackdesk.security.FeedbackInputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Feedback resource manager: validation, storage and instrumentation behind one CRUD contract.
 *
 * Every call records feedback_operations_total{operation, outcome} and
 * feedback_operation_duration_seconds before it returns or rethrows. Failures propagate
 * unchanged and nothing is retried here.
 *
 * Holds no state between calls; every read goes to storage.
 */
public final class FeedbackService {
    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final FeedbackInputValidator validator;
    private final FeedbackRepository repository;
    private final FeedbackMetrics metrics;
    private final Clock clock;

    public FeedbackService(FeedbackInputValidator validator, FeedbackRepository repository,
                           FeedbackMetrics metrics, Clock clock) {
        this.validator = validator;
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Validate and store a new feedback record.
     *
     * @throws FeedbackValidationException if the payload is invalid (nothing is stored)
     * @throws StorageUnavailableException if the store could not be written
     */
    public FeedbackRecord createFeedback(JsonNode raw) {
        return instrumented(FeedbackOperation.CREATE, () -> {
            ValidatedMessage message = validator.validate(raw);
            FeedbackRecord created = repository.create(message, Instant.now(clock));
            log.info("[FEEDBACK] Feedback created: id={}", created.id());
            refreshCount();
            return created;
        });
    }

    /**
     * @throws FeedbackNotFoundException if no present record has this id
     */
    public FeedbackRecord getFeedback(long id) {
        return instrumented(FeedbackOperation.READ, () -> {
            FeedbackRecord record = repository.findById(id)
                .orElseThrow(() -> new FeedbackNotFoundException(id));
            log.debug("[FEEDBACK] Retrieved feedback: id={}", id);
            return record;
        });
    }

    /**
     * All present records, id ascending. An empty store gives an empty list.
     */
    public List<FeedbackRecord> listFeedback() {
        return instrumented(FeedbackOperation.LIST, () -> {
            List<FeedbackRecord> records = repository.findAll();
            log.info("[FEEDBACK] Retrieved {} feedback entries", records.size());
            return records;
        });
    }

    /**
     * Replace the message of an existing record. The payload is validated before the
     * record is looked up, so an invalid payload for a missing id is a validation error.
     */
    public FeedbackRecord updateFeedback(long id, JsonNode raw) {
        return instrumented(FeedbackOperation.UPDATE, () -> {
            ValidatedMessage message = validator.validate(raw);
            FeedbackRecord updated = repository.update(id, message, Instant.now(clock))
                .orElseThrow(() -> new FeedbackNotFoundException(id));
            log.info("[FEEDBACK] Feedback updated: id={}", id);
            return updated;
        });
    }

    /**
     * @throws FeedbackNotFoundException if no present record has this id
     */
    public void deleteFeedback(long id) {
        instrumented(FeedbackOperation.DELETE, () -> {
            if (!repository.delete(id)) {
                throw new FeedbackNotFoundException(id);
            }
            log.info("[FEEDBACK] Feedback deleted: id={}", id);
            refreshCount();
            return null;
        });
    }

    /**
     * Number of stored records. Not an instrumented verb; used by the health check.
     */
    public long countFeedback() {
        return repository.count();
    }

    private <T> T instrumented(FeedbackOperation operation, Supplier<T> body) {
        long start = System.nanoTime();
        OperationOutcome outcome = OperationOutcome.STORAGE_ERROR;
        try {
            T result = body.get();
            outcome = OperationOutcome.SUCCESS;
            return result;
        } catch (FeedbackValidationException e) {
            outcome = OperationOutcome.VALIDATION_ERROR;
            log.info("[FEEDBACK] {} rejected: kind={}, reason={}", operation.label(), e.getKind().wireName(), e.getMessage());
            throw e;
        } catch (FeedbackNotFoundException e) {
            outcome = OperationOutcome.NOT_FOUND;
            log.info("[FEEDBACK] {} not found: id={}", operation.label(), e.getFeedbackId());
            throw e;
        } catch (StorageUnavailableException e) {
            metrics.recordError("StorageUnavailable");
            log.error("[FEEDBACK] {} failed, storage unavailable: {}", operation.label(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordError(e.getClass().getSimpleName());
            log.error("[FEEDBACK] {} failed unexpectedly: {}", operation.label(), e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordOperation(operation, outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    // Best effort: the record is already committed, so a failed count must not fail the call.
    private void refreshCount() {
        try {
            metrics.updateFeedbackCount(repository.count());
        } catch (StorageUnavailableException e) {
            log.warn("[FEEDBACK] Could not refresh feedback count: {}", e.getMessage());
        }
    }
}
