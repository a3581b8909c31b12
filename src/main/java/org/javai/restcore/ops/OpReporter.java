package org.javai.restcore.ops;

import java.time.Duration;

/**
 * Reports request failures for observability and operator notification.
 * Implementations might emit metrics, structured logs, or alerts.
 */
public interface OpReporter {

    /**
     * Reports an error about to be raised to the caller.
     */
    void report(RequestFailure failure);

    /**
     * Reports a retry.
     *
     * @param failure The failed attempt
     * @param attemptNumber The number of the failed attempt (1-based)
     * @param delay The backoff before the next attempt
     */
    default void reportRetryAttempt(RequestFailure failure, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a retryable condition surfaced because no attempts were left.
     *
     * @param failure The final failed attempt
     * @param totalAttempts The total number of attempts made
     */
    default void reportRetryExhausted(RequestFailure failure, int totalAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
