package com.williamcallahan.keycoordinator.service.retry;

import java.time.Duration;

/**
 * Blocks the calling thread between attempts. Replaced in tests to keep them instant.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Returns a sleeper backed by {@link Thread#sleep(long)}.
     */
    static Sleeper threadSleeper() {
        return duration -> {
            if (!duration.isZero() && !duration.isNegative()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
