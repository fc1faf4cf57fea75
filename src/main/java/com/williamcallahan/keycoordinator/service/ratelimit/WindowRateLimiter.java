package com.williamcallahan.keycoordinator.service.ratelimit;

import com.williamcallahan.keycoordinator.domain.ratelimit.RateLimitStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Fixed-window usage limiter keyed by resource and caller identifier.
 *
 * <p>A check either consumes its full cost or nothing. When disabled every check passes, which
 * matches running without a shared limiter store.</p>
 */
public class WindowRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(WindowRateLimiter.class);

    private final Map<String, RateLimitRule> rules;
    private final Clock clock;
    private final boolean enabled;
    private final ConcurrentHashMap<WindowKey, RateLimitWindow> windows = new ConcurrentHashMap<>();

    public WindowRateLimiter(Map<String, RateLimitRule> rules, Clock clock, boolean enabled) {
        Objects.requireNonNull(rules, "rules");
        this.rules = Map.copyOf(new LinkedHashMap<>(rules));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.enabled = enabled;
        if (!enabled) {
            log.info("Rate limiting disabled; all checks pass");
        }
    }

    /**
     * Consumes {@code cost} units from the caller's current window.
     *
     * @param resource configured resource name
     * @param identifier caller or session key
     * @param cost units to consume, zero allowed
     * @return the window status after consumption
     * @throws RateLimitExceededException when the cost does not fit; nothing is consumed
     * @throws IllegalArgumentException for an unknown resource, blank identifier or negative cost
     */
    public RateLimitStatus check(String resource, String identifier, long cost) {
        RateLimitRule rule = requireRule(resource);
        requireIdentifier(identifier);
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be non-negative");
        }
        Instant now = clock.instant();
        if (!enabled) {
            return new RateLimitStatus(resource, identifier, rule.limit(), rule.limit(), now.plus(rule.window()));
        }
        RateLimitStatus[] result = new RateLimitStatus[1];
        windows.compute(new WindowKey(resource, identifier), (key, existing) -> {
            RateLimitWindow window = existing == null ? new RateLimitWindow(rule, now) : existing;
            window.resetIfExpired(now);
            if (!window.fits(cost)) {
                Duration retryAfter = Duration.between(now, window.windowEnd());
                log.debug("Rate limit hit for {} (cost {}, remaining {})", resource, cost, window.remaining());
                throw new RateLimitExceededException(resource, identifier, retryAfter);
            }
            window.consume(cost);
            result[0] = new RateLimitStatus(resource, identifier, rule.limit(), window.remaining(), window.windowEnd());
            return window;
        });
        return result[0];
    }

    /**
     * Returns units consumed by an earlier {@link #check} to the same window.
     *
     * <p>Nothing happens when that window has since ended; a later window is never credited.</p>
     *
     * @param charged status returned by the check being undone
     * @param cost units that check consumed
     */
    void release(RateLimitStatus charged, long cost) {
        if (!enabled || cost <= 0) {
            return;
        }
        windows.computeIfPresent(new WindowKey(charged.resource(), charged.identifier()), (key, window) -> {
            if (window.windowEnd().equals(charged.resetAt()) && !window.isExpired(clock.instant())) {
                window.release(cost);
            }
            return window;
        });
    }

    /**
     * Reports the caller's current window without consuming anything.
     */
    public RateLimitStatus status(String resource, String identifier) {
        RateLimitRule rule = requireRule(resource);
        requireIdentifier(identifier);
        Instant now = clock.instant();
        RateLimitStatus fresh =
                new RateLimitStatus(resource, identifier, rule.limit(), rule.limit(), now.plus(rule.window()));
        if (!enabled) {
            return fresh;
        }
        RateLimitStatus[] result = {fresh};
        windows.computeIfPresent(new WindowKey(resource, identifier), (key, window) -> {
            if (!window.isExpired(now)) {
                result[0] = new RateLimitStatus(
                        resource, identifier, rule.limit(), window.remaining(), window.windowEnd());
            }
            return window;
        });
        return result[0];
    }

    /**
     * Drops windows whose period has ended. Safe to run concurrently with checks.
     *
     * @return number of windows removed
     */
    @Scheduled(fixedDelayString = "${app.rate-limits.eviction-interval:PT5M}")
    public int evictExpiredWindows() {
        Instant now = clock.instant();
        int removed = 0;
        for (WindowKey key : windows.keySet()) {
            boolean[] evicted = new boolean[1];
            windows.computeIfPresent(key, (ignored, window) -> {
                evicted[0] = window.isExpired(now);
                return evicted[0] ? null : window;
            });
            if (evicted[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} expired rate limit window(s)", removed);
        }
        return removed;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean hasRule(String resource) {
        return resource != null && rules.containsKey(resource);
    }

    public Set<String> resources() {
        return rules.keySet();
    }

    int trackedWindowCount() {
        return windows.size();
    }

    private RateLimitRule requireRule(String resource) {
        RateLimitRule rule = resource == null ? null : rules.get(resource);
        if (rule == null) {
            throw new IllegalArgumentException("Unknown rate limit resource: " + resource);
        }
        return rule;
    }

    private static void requireIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Rate limit identifier is required");
        }
    }

    private record WindowKey(String resource, String identifier) {}
}
