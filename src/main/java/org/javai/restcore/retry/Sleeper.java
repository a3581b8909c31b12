package org.javai.restcore.retry;

import java.time.Duration;

/**
 * Blocks the calling thread. Replaced in tests so that backoff never sleeps for real.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * The default sleeper, backed by {@link Thread#sleep(long, int)}.
     */
    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
    }
}
