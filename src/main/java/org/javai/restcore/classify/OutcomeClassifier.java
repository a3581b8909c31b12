package org.javai.restcore.classify;

import java.util.Objects;
import org.javai.restcore.http.Response;
import org.javai.restcore.retry.RetryStrategy;

/**
 * Classifies the outcome of one attempt. Pure: the result depends only on the arguments and
 * is computed afresh for every attempt.
 */
public final class OutcomeClassifier {

    private final TransportFailureClassifier transportClassifier;

    public OutcomeClassifier(TransportFailureClassifier transportClassifier) {
        this.transportClassifier = Objects.requireNonNull(transportClassifier, "transportClassifier must not be null");
    }

    /**
     * @param outcome what the attempt produced
     * @param state the retry state the attempt was made under
     * @param refreshable whether the authorizer can obtain a new token
     */
    public ResponseClassification classify(AttemptOutcome outcome, RetryStrategy state, boolean refreshable) {
        boolean canRetry = state.shouldRetryOnFailure();

        if (outcome instanceof AttemptOutcome.TransportFailed failed) {
            return canRetry && transportClassifier.isTransient(failed.exception().originalCause())
                    ? ResponseClassification.RETRYABLE_TRANSPORT_ERROR
                    : ResponseClassification.TERMINAL_TRANSPORT_ERROR;
        }

        Response response = ((AttemptOutcome.Responded) outcome).response();
        int status = response.statusCode();
        if (canRetry && status == StatusTable.UNAUTHORIZED && refreshable) {
            return ResponseClassification.AUTH_EXPIRED;
        }
        if (canRetry && StatusTable.isRetryable(status)) {
            return ResponseClassification.RETRYABLE_STATUS;
        }
        if (StatusTable.hasException(status)) {
            return ResponseClassification.TERMINAL_STATUS;
        }
        if (status == StatusTable.NO_CONTENT) {
            return ResponseClassification.NO_CONTENT;
        }
        if (StatusTable.isSuccess(status)) {
            return ResponseClassification.SUCCESS;
        }
        return ResponseClassification.UNEXPECTED_STATUS;
    }

    /**
     * Whether the outcome would have been retried had attempts remained.
     */
    public boolean wouldRetry(AttemptOutcome outcome, boolean refreshable) {
        if (outcome instanceof AttemptOutcome.TransportFailed failed) {
            return transportClassifier.isTransient(failed.exception().originalCause());
        }
        int status = ((AttemptOutcome.Responded) outcome).response().statusCode();
        return (status == StatusTable.UNAUTHORIZED && refreshable) || StatusTable.isRetryable(status);
    }
}
