package com.williamcallahan.keycoordinator.service.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.keycoordinator.support.MutableClock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Covers header parsing behavior for retry hints.
 */
class RateLimitHeaderParserTest {

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    private final RateLimitHeaderParser parser = new RateLimitHeaderParser(clock);

    @Test
    void parseRetryAfter_acceptsSecondsAndHttpDates() {
        assertEquals(Duration.ofSeconds(120), parser.parseRetryAfter("120"));
        assertEquals(Duration.ofSeconds(90), parser.parseRetryAfter("Wed, 01 Jan 2025 00:01:30 GMT"));
    }

    @Test
    void parseRetryAfter_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> parser.parseRetryAfter("abc"));
    }

    @Test
    void parseResetValue_distinguishesEpochFromRelativeSeconds() {
        long epochSeconds = clock.instant().getEpochSecond() + 45;

        assertEquals(Duration.ofSeconds(45), parser.parseResetValue(Long.toString(epochSeconds)));
        assertEquals(Duration.ofSeconds(12), parser.parseResetValue("12"));
    }

    @Test
    void parseDuration_supportsUnitSuffixes() {
        assertEquals(Duration.ofMillis(500), parser.parseDuration("500ms"));
        assertEquals(Duration.ofMinutes(1), parser.parseDuration("1m"));
        assertEquals(Duration.ofMillis(1500), parser.parseDuration("1.5s"));
        assertThrows(IllegalArgumentException.class, () -> parser.parseDuration("2 fortnights"));
    }

    @Test
    void parseRetryHint_prefersRetryAfterThenShortestReset() {
        Map<String, String> both = Map.of("Retry-After", "3", "x-ratelimit-reset-tokens", "20s");
        Map<String, String> resets = Map.of("x-ratelimit-reset-requests", "20s", "x-ratelimit-reset-tokens", "6s");

        assertEquals(Optional.of(Duration.ofSeconds(3)), parser.parseRetryHint(both::get));
        assertEquals(Optional.of(Duration.ofSeconds(6)), parser.parseRetryHint(resets::get));
        assertTrue(parser.parseRetryHint(name -> null).isEmpty());
    }

    @Test
    void outOfRangeValuesAreRejectedAsInvalidHeaders() {
        assertThrows(IllegalArgumentException.class, () -> parser.parseResetValue("99999999999999999"));
        assertThrows(IllegalArgumentException.class, () -> parser.parseDuration("999999999999999d"));
        assertThrows(IllegalArgumentException.class,
                () -> parser.parseRetryHint(Map.of("x-ratelimit-reset-tokens", "9999999999999999h")::get));
    }
}
