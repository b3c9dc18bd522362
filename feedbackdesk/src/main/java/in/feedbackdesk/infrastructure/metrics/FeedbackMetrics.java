package in.feedbackdesk.infrastructure.metrics;

import in.feedbackdesk.domain.model.FeedbackOperation;
import in.feedbackdesk.domain.model.OperationOutcome;

import java.time.Duration;

/**
 * Feedback metrics interface for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or anything else a scraper can read.
 *
 * Key metrics:
 * - Operation counts by verb and outcome
 * - Operation latency per verb
 * - Current number of stored records
 * - HTTP request counts and latency per route
 * - Error counts by type
 */
public interface FeedbackMetrics {

    /**
     * Record one feedback operation.
     *
     * @param operation Verb (create, read, list, update, delete)
     * @param outcome Outcome category
     * @param duration Time spent in the operation, failures included
     */
    void recordOperation(FeedbackOperation operation, OperationOutcome outcome, Duration duration);

    /**
     * Set the current number of stored feedback records.
     */
    void updateFeedbackCount(long count);

    /**
     * Record one HTTP request.
     *
     * @param method HTTP method
     * @param endpoint Route template (e.g. /feedback/:id), never the raw path
     * @param status Response status code
     * @param duration Time from dispatch to response completion
     */
    void recordHttpRequest(String method, String endpoint, int status, Duration duration);

    /**
     * Record an error by type (exception simple name or failure category).
     */
    void recordError(String errorType);
}
