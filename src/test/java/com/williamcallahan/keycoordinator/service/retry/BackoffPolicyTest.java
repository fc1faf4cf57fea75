package com.williamcallahan.keycoordinator.service.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

    @Test
    void delaysGrowExponentiallyUpToTheCap() {
        BackoffPolicy policy = new BackoffPolicy(
                Duration.ofSeconds(2), 2.0, Duration.ofSeconds(15), Duration.ZERO, new Random(1));

        assertEquals(Duration.ofSeconds(2), policy.delayFor(0));
        assertEquals(Duration.ofSeconds(4), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(8), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(15), policy.delayFor(3));
        assertEquals(Duration.ofSeconds(15), policy.delayFor(30));
    }

    @Test
    void jitterStaysWithinItsBound() {
        BackoffPolicy policy = new BackoffPolicy(
                Duration.ofSeconds(1), 2.0, Duration.ofSeconds(15), Duration.ofMillis(500), new Random(42));

        for (int index = 0; index < 50; index++) {
            Duration delay = policy.delayFor(0);
            assertTrue(delay.compareTo(Duration.ofSeconds(1)) >= 0, "delay below base: " + delay);
            assertTrue(delay.compareTo(Duration.ofMillis(1500)) < 0, "delay above jitter bound: " + delay);
        }
    }

    @Test
    void jitterNeverPushesTheDelayPastTheCap() {
        BackoffPolicy policy = new BackoffPolicy(
                Duration.ofSeconds(8), 2.0, Duration.ofSeconds(15), Duration.ofSeconds(1), new Random(3));

        for (int index = 0; index < 50; index++) {
            assertEquals(Duration.ofSeconds(15), policy.delayFor(1 + index % 3));
            Duration first = policy.delayFor(0);
            assertTrue(first.compareTo(Duration.ofSeconds(8)) >= 0, "delay below base: " + first);
            assertTrue(first.compareTo(Duration.ofSeconds(9)) < 0, "delay above jitter bound: " + first);
        }
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(
                Duration.ofSeconds(1), 0.5, Duration.ofSeconds(15), Duration.ZERO, new Random()));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(
                Duration.ofSeconds(-1), 2.0, Duration.ofSeconds(15), Duration.ZERO, new Random()));

        BackoffPolicy policy = new BackoffPolicy(
                BackoffPolicy.DEFAULT_INITIAL_BACKOFF,
                BackoffPolicy.DEFAULT_MULTIPLIER,
                BackoffPolicy.DEFAULT_MAX_BACKOFF,
                BackoffPolicy.DEFAULT_JITTER,
                new Random());
        assertThrows(IllegalArgumentException.class, () -> policy.delayFor(-1));
    }
}
