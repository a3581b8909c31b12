package org.javai.restcore.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides how many attempts a logical request may make and how long to wait between them.
 *
 * <p>Implementations are immutable. A request starts from a template instance and walks down a
 * chain of snapshots, each obtained with {@link #consumeAvailableRetry()} and used for exactly one
 * attempt, so one template can be shared by any number of concurrent requests.
 */
public interface RetryStrategy {

    /**
     * The wait to observe after a failed attempt made under this state, before the next attempt.
     *
     * @return the delay, or empty when no wait is needed
     */
    Optional<Duration> sleepDuration();

    /**
     * Whether a failed attempt made under this state may be followed by another attempt.
     */
    boolean shouldRetryOnFailure();

    /**
     * Returns the state for the next attempt. The receiver is left untouched.
     */
    RetryStrategy consumeAvailableRetry();

    /**
     * The number of attempts left, counting the one made under this state.
     */
    int remainingRetries();
}
