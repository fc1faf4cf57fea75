package com.williamcallahan.keycoordinator.service.retry;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.failure.AttemptOutcome;
import com.williamcallahan.keycoordinator.domain.failure.ErrorCategory;
import com.williamcallahan.keycoordinator.domain.failure.FailureClassification;
import com.williamcallahan.keycoordinator.domain.failure.ProviderFailure;
import com.williamcallahan.keycoordinator.domain.failure.RetryAttempt;
import com.williamcallahan.keycoordinator.service.classify.ErrorClassifier;
import com.williamcallahan.keycoordinator.service.classify.ProviderErrorNormalizer;
import com.williamcallahan.keycoordinator.service.credential.Credential;
import com.williamcallahan.keycoordinator.service.credential.CredentialPool;
import com.williamcallahan.keycoordinator.service.credential.CredentialPoolRegistry;
import com.williamcallahan.keycoordinator.service.credential.CredentialSelection;
import com.williamcallahan.keycoordinator.service.credential.CredentialSelector;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a unit of work against a provider, rotating credentials on failure.
 *
 * <p>This is the only retry layer: units of work make one call per invocation and the clients they
 * use have SDK retries disabled. Every failure cools the credential down according to its
 * classification before the next credential is selected. Rotation after queue, rate, quota or
 * authentication failures is immediate; a backoff is taken after server or unclassified failures
 * and before every forced reuse of a cooling credential.</p>
 */
public class RetryCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RetryCoordinator.class);

    private final CredentialPoolRegistry registry;
    private final CredentialSelector selector;
    private final ProviderErrorNormalizer normalizer;
    private final ErrorClassifier classifier;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final int maxUnclassifiedAttempts;
    private final Duration defaultMaxTotalDuration;

    public RetryCoordinator(
            CredentialPoolRegistry registry,
            CredentialSelector selector,
            ProviderErrorNormalizer normalizer,
            ErrorClassifier classifier,
            BackoffPolicy backoffPolicy,
            Sleeper sleeper,
            Clock clock,
            int maxUnclassifiedAttempts,
            Duration defaultMaxTotalDuration) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxUnclassifiedAttempts < 1) {
            throw new IllegalArgumentException("maxUnclassifiedAttempts must be at least 1");
        }
        this.maxUnclassifiedAttempts = maxUnclassifiedAttempts;
        this.defaultMaxTotalDuration = defaultMaxTotalDuration;
    }

    /**
     * Executes the unit of work with credential rotation.
     *
     * @param unitOfWork single provider call bound to a credential
     * @param options provider and attempt limits for this run
     * @param <R> result type
     * @return the first successful result
     * @throws FinalFailureException when attempts are exhausted, the time budget runs out, an
     *     authentication failure leaves no usable credential, or unclassified failures repeat
     * @throws com.williamcallahan.keycoordinator.service.credential.PoolConfigurationException when
     *     the provider has no pool
     * @throws IllegalStateException when the thread is interrupted
     */
    public <R> R executeWithRetry(UnitOfWork<R> unitOfWork, RetryOptions options) {
        Objects.requireNonNull(unitOfWork, "unitOfWork");
        Objects.requireNonNull(options, "options");
        ApiProvider provider = options.provider();
        CredentialPool pool = registry.poolFor(provider);
        int maxAttempts = options.maxAttempts() > 0 ? options.maxAttempts() : pool.size();
        Duration budget = options.maxTotalDuration() != null ? options.maxTotalDuration() : defaultMaxTotalDuration;
        Instant deadline = budget == null ? null : clock.instant().plus(budget);

        List<RetryAttempt> attempts = new ArrayList<>(maxAttempts);
        FailureClassification lastClassification = null;
        Exception lastError = null;
        ErrorCategory previousCategory = null;
        int backoffsTaken = 0;
        int unclassifiedFailures = 0;

        for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            if (deadline != null && attemptNumber > 1 && !clock.instant().isBefore(deadline)) {
                log.warn("[{}] {} exceeded its {}ms budget after {} attempt(s)",
                        provider.getName(), options.operation(), budget.toMillis(), attempts.size());
                break;
            }

            CredentialSelection selection = selector.next(pool);
            Credential credential = selection.credential();
            if (selection.forcedReuse() || (previousCategory != null && !previousCategory.rotatesImmediately())) {
                Duration delay = backoffPolicy.delayFor(backoffsTaken++);
                log.debug("[{}] Backing off {}ms before attempt {}/{}",
                        provider.getName(), delay.toMillis(), attemptNumber, maxAttempts);
                pause(delay);
            }

            Instant attemptStart = clock.instant();
            try {
                R result = unitOfWork.execute(credential);
                pool.recordSuccess(credential);
                attempts.add(new RetryAttempt(attemptNumber, credential.maskedId(), selection.forcedReuse(),
                        AttemptOutcome.SUCCESS, null, Duration.between(attemptStart, clock.instant())));
                if (attemptNumber > 1) {
                    log.info("[{}] {} succeeded on attempt {}/{} with key {}",
                            provider.getName(), options.operation(), attemptNumber, maxAttempts, credential.maskedId());
                }
                return result;
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Coordinated call interrupted", interrupted);
            } catch (Exception failure) {
                ProviderFailure normalized = normalizer.normalize(failure);
                FailureClassification classification = classifier.classify(provider, normalized);
                ErrorCategory category = classification.category();
                Instant disabledUntil = pool.disable(credential, classification.cooldown(), category);
                attempts.add(new RetryAttempt(
                        attemptNumber,
                        credential.maskedId(),
                        selection.forcedReuse(),
                        category == ErrorCategory.UNCLASSIFIED
                                ? AttemptOutcome.UNCLASSIFIED_FAILURE
                                : AttemptOutcome.CLASSIFIED_FAILURE,
                        category,
                        Duration.between(attemptStart, clock.instant())));
                log.warn("[{}] Attempt {}/{} with key {} failed ({}, status {}); disabled {}",
                        provider.getName(), attemptNumber, maxAttempts, credential.maskedId(), category.key(),
                        normalized.hasStatus() ? normalized.httpStatus() : "none",
                        classification.isPermanent() ? "permanently" : "for " + classification.cooldownMs() + "ms");
                log.debug("[{}] Key {} disabled until {}: {}",
                        provider.getName(), credential.maskedId(), disabledUntil, normalized.message());

                lastClassification = classification;
                lastError = failure;
                previousCategory = category;

                if (!classification.retryable() && !pool.hasRecoverableCredential()) {
                    log.error("[{}] No recoverable keys left after {}", provider.getName(), category.key());
                    break;
                }
                if (category == ErrorCategory.UNCLASSIFIED && ++unclassifiedFailures >= maxUnclassifiedAttempts) {
                    log.error("[{}] Giving up after {} unclassified failure(s)", provider.getName(), unclassifiedFailures);
                    break;
                }
            }
        }

        FinalFailureException finalFailure =
                new FinalFailureException(provider, lastClassification, attempts, lastError);
        log.error("[{}] {} failed: {}", provider.getName(), options.operation(), finalFailure.getMessage());
        throw finalFailure;
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", interrupted);
        }
    }
}
