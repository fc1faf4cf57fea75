package com.williamcallahan.keycoordinator.service.ratelimit;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.ratelimit.RateLimitStatus;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies per-caller provider budgets before a coordinated call starts.
 *
 * <p>LLM calls are checked against {@code <provider>-tokens-minute}, {@code <provider>-tokens-day}
 * and {@code <provider>-requests-minute}; search calls against {@code <provider>-requests-minute}.
 * Budgets without a configured rule are skipped. All applicable budgets are verified before any of
 * them is consumed, and charges already taken are returned when a concurrent caller exhausts a later
 * budget first, so a rejected call leaves every window untouched.</p>
 */
public class ProviderBudgetGate {
    private static final Logger log = LoggerFactory.getLogger(ProviderBudgetGate.class);

    private final WindowRateLimiter rateLimiter;
    private final Clock clock;

    public ProviderBudgetGate(WindowRateLimiter rateLimiter, Clock clock) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Checks and consumes the token and request budgets for an LLM call.
     *
     * @param provider LLM provider
     * @param identifier caller key
     * @param estimatedTokens estimated prompt plus completion tokens
     * @throws RateLimitExceededException when any budget would be exceeded
     */
    public void checkLlmBudget(ApiProvider provider, String identifier, long estimatedTokens) {
        List<Charge> charges = new ArrayList<>();
        addIfConfigured(charges, provider, RateLimitResources.TOKENS_PER_MINUTE, estimatedTokens);
        addIfConfigured(charges, provider, RateLimitResources.TOKENS_PER_DAY, estimatedTokens);
        addIfConfigured(charges, provider, RateLimitResources.REQUESTS_PER_MINUTE, 1);
        apply(charges, identifier);
    }

    /**
     * Checks and consumes one request of the search budget.
     */
    public void checkSearchBudget(ApiProvider provider, String identifier) {
        List<Charge> charges = new ArrayList<>();
        addIfConfigured(charges, provider, RateLimitResources.REQUESTS_PER_MINUTE, 1);
        apply(charges, identifier);
    }

    private void addIfConfigured(List<Charge> charges, ApiProvider provider, String budget, long cost) {
        String resource = RateLimitResources.forProvider(provider.getName(), budget);
        if (rateLimiter.hasRule(resource)) {
            charges.add(new Charge(resource, cost));
        }
    }

    private void apply(List<Charge> charges, String identifier) {
        if (!rateLimiter.isEnabled() || charges.isEmpty()) {
            return;
        }
        for (Charge charge : charges) {
            RateLimitStatus status = rateLimiter.status(charge.resource(), identifier);
            if (charge.cost() > status.remaining()) {
                log.info("Budget {} exhausted for caller (needs {}, remaining {})",
                        charge.resource(), charge.cost(), status.remaining());
                Duration retryAfter = Duration.between(clock.instant(), status.resetAt());
                throw new RateLimitExceededException(
                        charge.resource(), identifier, retryAfter.isNegative() ? Duration.ZERO : retryAfter);
            }
        }
        List<RateLimitStatus> applied = new ArrayList<>(charges.size());
        try {
            for (Charge charge : charges) {
                applied.add(rateLimiter.check(charge.resource(), identifier, charge.cost()));
            }
        } catch (RateLimitExceededException lostRace) {
            for (int index = applied.size() - 1; index >= 0; index--) {
                rateLimiter.release(applied.get(index), charges.get(index).cost());
            }
            log.debug("Returned {} partial charge(s) after {} filled up", applied.size(), lostRace.resource());
            throw lostRace;
        }
    }

    private record Charge(String resource, long cost) {}
}
