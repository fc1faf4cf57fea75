package com.williamcallahan.keycoordinator.service.classify;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongFunction;
import java.util.function.UnaryOperator;

/**
 * Turns provider rate-limit response headers into a wait hint.
 *
 * <p>Header access goes through a lookup function so OpenAI SDK headers and Spring
 * {@code HttpHeaders} share the same parsing rules. Lookups are expected to be case-insensitive.</p>
 */
public final class RateLimitHeaderParser {

    static final String RETRY_AFTER = "Retry-After";
    static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";
    private static final String[] RESET_DURATION_HEADERS = {
        "x-ratelimit-reset-requests", "x-ratelimit-reset-tokens", "x-ratelimit-reset-requests-minute",
        "x-ratelimit-reset-tokens-minute"
    };

    /** Reset values larger than this are treated as epoch seconds rather than relative seconds. */
    private static final long EPOCH_SECONDS_THRESHOLD = 1_000_000_000L;

    private enum DurationUnit {
        MILLISECONDS("ms", Duration::ofMillis),
        DAYS("d", Duration::ofDays),
        HOURS("h", Duration::ofHours),
        MINUTES("m", Duration::ofMinutes),
        SECONDS("s", Duration::ofSeconds);

        private final String suffix;
        private final LongFunction<Duration> toDuration;

        DurationUnit(String suffix, LongFunction<Duration> toDuration) {
            this.suffix = suffix;
            this.toDuration = toDuration;
        }

        boolean matches(String normalized) {
            return normalized.endsWith(suffix);
        }

        String extractNumber(String normalized) {
            return normalized.substring(0, normalized.length() - suffix.length()).trim();
        }

        Duration convert(long value) {
            try {
                return toDuration.apply(value);
            } catch (ArithmeticException overflow) {
                throw new IllegalArgumentException("Reset duration out of range: " + value + suffix, overflow);
            }
        }
    }

    private final Clock clock;

    public RateLimitHeaderParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Resolves the wait hint from response headers.
     *
     * <p>{@code Retry-After} wins when present; otherwise the shortest positive reset window among
     * the known reset headers is used.</p>
     *
     * @param headerLookup returns the first value of a header, or null when absent
     * @return the hint, or empty when the response carries no timing headers
     * @throws IllegalArgumentException when a present header cannot be parsed
     */
    public Optional<Duration> parseRetryHint(UnaryOperator<String> headerLookup) {
        Objects.requireNonNull(headerLookup, "headerLookup");
        String retryAfter = headerLookup.apply(RETRY_AFTER);
        if (retryAfter != null && !retryAfter.isBlank()) {
            return Optional.of(parseRetryAfter(retryAfter));
        }
        String reset = headerLookup.apply(RATE_LIMIT_RESET);
        if (reset != null && !reset.isBlank()) {
            return Optional.of(parseResetValue(reset));
        }
        Duration shortest = null;
        for (String headerName : RESET_DURATION_HEADERS) {
            String raw = headerLookup.apply(headerName);
            if (raw == null || raw.isBlank()) {
                continue;
            }
            Duration candidate = parseDuration(raw);
            if (!candidate.isZero() && (shortest == null || candidate.compareTo(shortest) < 0)) {
                shortest = candidate;
            }
        }
        return Optional.ofNullable(shortest);
    }

    /**
     * Parses a {@code Retry-After} value given as delta seconds or an HTTP date.
     */
    Duration parseRetryAfter(String rawValue) {
        String trimmed = rawValue.trim();
        if (isDigits(trimmed)) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        try {
            ZonedDateTime httpDate = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            return nonNegative(Duration.between(clock.instant(), httpDate.toInstant()));
        } catch (DateTimeParseException parseFailure) {
            throw new IllegalArgumentException("Invalid Retry-After header: " + trimmed, parseFailure);
        }
    }

    /**
     * Parses an {@code X-RateLimit-Reset} value: epoch seconds, relative seconds, or an ISO instant.
     */
    Duration parseResetValue(String rawValue) {
        String trimmed = rawValue.trim();
        if (isDigits(trimmed)) {
            long value = Long.parseLong(trimmed);
            if (value >= EPOCH_SECONDS_THRESHOLD) {
                if (value > Instant.MAX.getEpochSecond()) {
                    throw new IllegalArgumentException("X-RateLimit-Reset out of range: " + trimmed);
                }
                return nonNegative(Duration.between(clock.instant(), Instant.ofEpochSecond(value)));
            }
            return Duration.ofSeconds(value);
        }
        try {
            return nonNegative(Duration.between(clock.instant(), Instant.parse(trimmed)));
        } catch (DateTimeParseException parseFailure) {
            throw new IllegalArgumentException("Invalid X-RateLimit-Reset header: " + trimmed, parseFailure);
        }
    }

    /**
     * Parses a duration such as {@code 2s}, {@code 500ms}, {@code 1m} or bare seconds.
     */
    Duration parseDuration(String rawValue) {
        String trimmed = rawValue.trim().toLowerCase(Locale.ROOT);
        if (isDigits(trimmed)) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        if (isDecimalSeconds(trimmed)) {
            String numberPart = trimmed.substring(0, trimmed.length() - 1);
            return Duration.ofMillis(Math.round(Double.parseDouble(numberPart) * 1000));
        }
        for (DurationUnit unit : DurationUnit.values()) {
            if (unit.matches(trimmed)) {
                String numberPart = unit.extractNumber(trimmed);
                if (!isDigits(numberPart)) {
                    throw new IllegalArgumentException("Invalid reset duration header: " + rawValue);
                }
                return unit.convert(Long.parseLong(numberPart));
            }
        }
        throw new IllegalArgumentException("Invalid reset duration header: " + rawValue);
    }

    private static boolean isDecimalSeconds(String candidate) {
        if (!candidate.endsWith("s") || candidate.endsWith("ms")) {
            return false;
        }
        String numberPart = candidate.substring(0, candidate.length() - 1);
        int dot = numberPart.indexOf('.');
        return dot > 0
                && dot < numberPart.length() - 1
                && isDigits(numberPart.substring(0, dot))
                && isDigits(numberPart.substring(dot + 1));
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }

    private static boolean isDigits(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        for (int index = 0; index < candidate.length(); index++) {
            if (!Character.isDigit(candidate.charAt(index))) {
                return false;
            }
        }
        return true;
    }
}
