package com.williamcallahan.keycoordinator.service.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential backoff with additive random jitter, capped after the jitter is added.
 */
public final class BackoffPolicy {

    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(2);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(15);
    public static final Duration DEFAULT_JITTER = Duration.ofSeconds(1);

    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final Duration jitter;
    private final Random random;

    public BackoffPolicy(Duration initialBackoff, double multiplier, Duration maxBackoff, Duration jitter, Random random) {
        this.initialBackoff = requireNonNegative(initialBackoff, "initialBackoff");
        this.maxBackoff = requireNonNegative(maxBackoff, "maxBackoff");
        this.jitter = requireNonNegative(jitter, "jitter");
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        this.multiplier = multiplier;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Returns the delay before the given backoff, counted from zero within one run.
     *
     * @param backoffIndex zero-based number of backoffs already taken in the run
     * @return exponential delay plus jitter, never above the maximum backoff
     */
    public Duration delayFor(int backoffIndex) {
        if (backoffIndex < 0) {
            throw new IllegalArgumentException("backoffIndex must be non-negative");
        }
        long maxMillis = maxBackoff.toMillis();
        double scaled = initialBackoff.toMillis() * Math.pow(multiplier, backoffIndex);
        long baseMillis = (long) Math.min(scaled, (double) maxMillis);
        long jitterMillis = jitter.isZero() ? 0 : (long) (random.nextDouble() * jitter.toMillis());
        return Duration.ofMillis(Math.min(baseMillis + jitterMillis, maxMillis));
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
        return value;
    }
}
