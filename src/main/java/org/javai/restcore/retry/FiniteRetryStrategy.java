package org.javai.restcore.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * A {@link RetryStrategy} allowing a fixed number of attempts.
 *
 * <p>The first retry waits a random {@code [0, 2)} seconds and the second a random
 * {@code [2, 4)} seconds. Strategies allowing more than three attempts retry immediately
 * until the last two retries, so the total time spent waiting stays below four seconds plus
 * the jitter of one retry.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryStrategy state = new FiniteRetryStrategy();     // 3 attempts
 * state.shouldRetryOnFailure();                        // true
 * state.sleepDuration();                               // Optional[PT0.73S]
 * RetryStrategy next = state.consumeAvailableRetry();  // 2 attempts left, state unchanged
 * }</pre>
 */
public final class FiniteRetryStrategy implements RetryStrategy {

    public static final int DEFAULT_RETRIES = 3;

    private static final double JITTER_SECONDS = 2.0;

    private final int retries;
    private final DoubleSupplier jitter;

    /**
     * Creates a strategy allowing {@value #DEFAULT_RETRIES} attempts.
     */
    public FiniteRetryStrategy() {
        this(DEFAULT_RETRIES);
    }

    /**
     * Creates a strategy allowing the given number of attempts.
     *
     * @param retries the number of attempts (must not be negative)
     * @throws IllegalArgumentException if retries is negative
     */
    public FiniteRetryStrategy(int retries) {
        this(retries, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a strategy with a custom jitter source returning values in {@code [0, 1)}.
     * Package-private for testing.
     */
    FiniteRetryStrategy(int retries, DoubleSupplier jitter) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, was: " + retries);
        }
        this.retries = retries;
        this.jitter = Objects.requireNonNull(jitter, "jitter must not be null");
    }

    @Override
    public Optional<Duration> sleepDuration() {
        if (retries > 3 || retries < 2) {
            return Optional.empty();
        }
        double base = retries == 3 ? 0.0 : 2.0;
        double seconds = base + JITTER_SECONDS * jitter.getAsDouble();
        return Optional.of(Duration.ofNanos((long) (seconds * 1_000_000_000L)));
    }

    @Override
    public boolean shouldRetryOnFailure() {
        return retries > 1;
    }

    @Override
    public FiniteRetryStrategy consumeAvailableRetry() {
        if (retries == 0) {
            throw new IllegalStateException("no retries left to consume");
        }
        return new FiniteRetryStrategy(retries - 1, jitter);
    }

    @Override
    public int remainingRetries() {
        return retries;
    }

    @Override
    public String toString() {
        return "FiniteRetryStrategy[retries=" + retries + "]";
    }
}
