package org.javai.restcore.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.javai.restcore.PreparedRequest;
import org.javai.restcore.http.Response;
import org.javai.restcore.http.TransportCall;
import org.javai.restcore.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link RateLimiter} driven by the {@code X-Ratelimit-*} headers the server returns.
 *
 * <p>When the quota is exhausted the next call waits for the reset. Otherwise calls are spread
 * so the remaining quota lasts until the reset, waiting at most ten seconds between calls.
 */
public final class HeaderRateLimiter implements RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderRateLimiter.class);

    static final String REMAINING_HEADER = "x-ratelimit-remaining";
    static final String USED_HEADER = "x-ratelimit-used";
    static final String RESET_HEADER = "x-ratelimit-reset";

    private static final double MAX_SPACING_SECONDS = 10.0;

    private final Clock clock;
    private final Sleeper sleeper;

    private Double remaining;
    private Integer used;
    private Instant resetTimestamp;
    private Instant nextRequestTimestamp;

    public HeaderRateLimiter() {
        this(Clock.systemUTC(), Sleeper.system());
    }

    public HeaderRateLimiter(Clock clock, Sleeper sleeper) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    @Override
    public Response call(TransportCall transport, Supplier<Map<String, String>> headerCallback, PreparedRequest request) {
        delay();
        Map<String, String> headers = headerCallback.get();
        Response response = transport.request(request, headers);
        update(response);
        return response;
    }

    /**
     * Blocks until the next request may be sent.
     */
    void delay() {
        Instant next;
        synchronized (this) {
            next = nextRequestTimestamp;
        }
        if (next == null) {
            return;
        }
        Duration wait = Duration.between(clock.instant(), next);
        if (wait.isZero() || wait.isNegative()) {
            return;
        }
        logger.debug("Sleeping: {} seconds prior to call", String.format("%.2f", wait.toMillis() / 1000.0));
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Updates the bookkeeping from the headers of a response.
     */
    synchronized void update(Response response) {
        Optional<String> remainingHeader = response.header(REMAINING_HEADER);
        if (remainingHeader.isEmpty()) {
            if (remaining != null) {
                remaining -= 1;
                used = used == null ? 1 : used + 1;
            }
            return;
        }

        double newRemaining;
        long secondsToReset;
        Integer newUsed;
        try {
            newRemaining = Double.parseDouble(remainingHeader.get().trim());
            secondsToReset = Long.parseLong(response.header(RESET_HEADER).orElse("0").trim());
            String usedHeader = response.header(USED_HEADER).orElse(null);
            newUsed = usedHeader == null ? used : Integer.valueOf(usedHeader.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed rate limit headers: {}", e.getMessage());
            return;
        }

        Instant now = clock.instant();
        remaining = newRemaining;
        used = newUsed;
        resetTimestamp = now.plusSeconds(secondsToReset);

        if (newRemaining <= 0) {
            nextRequestTimestamp = resetTimestamp;
            return;
        }

        double spacing = Math.max(Math.min((secondsToReset - newRemaining) / 2, MAX_SPACING_SECONDS), 0);
        Instant spaced = now.plusNanos((long) (spacing * 1_000_000_000L));
        nextRequestTimestamp = spaced.isBefore(resetTimestamp) ? spaced : resetTimestamp;
    }

    public synchronized Optional<Double> remaining() {
        return Optional.ofNullable(remaining);
    }

    public synchronized Optional<Integer> used() {
        return Optional.ofNullable(used);
    }

    public synchronized Optional<Instant> resetTimestamp() {
        return Optional.ofNullable(resetTimestamp);
    }

    public synchronized Optional<Instant> nextRequestTimestamp() {
        return Optional.ofNullable(nextRequestTimestamp);
    }
}
