package com.williamcallahan.keycoordinator.domain.ratelimit;

import java.time.Instant;

/**
 * Current budget for one rate-limit window, reported without consuming any of it.
 *
 * @param resource rate-limited resource name
 * @param identifier caller or session key
 * @param limit maximum cost per window
 * @param remaining cost still available in the current window
 * @param resetAt when the current window ends
 */
public record RateLimitStatus(String resource, String identifier, long limit, long remaining, Instant resetAt) {}
