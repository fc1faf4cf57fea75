package com.williamcallahan.keycoordinator.service.credential;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.credential.CredentialSnapshot;
import com.williamcallahan.keycoordinator.domain.failure.ErrorCategory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the interchangeable credentials of one provider together with their health state.
 *
 * <p>Insertion order is rotation order. Every public operation is atomic with respect to the others
 * through a single lock; no I/O happens while it is held. Pools of different providers share
 * nothing.</p>
 */
public final class CredentialPool {
    private static final Logger log = LoggerFactory.getLogger(CredentialPool.class);

    /** Forced-reuse ranking: recoverable keys first, quota-exhausted keys last among those, then longest idle. */
    private static final Comparator<CredentialHealth> FORCED_REUSE_ORDER = Comparator
            .comparing(CredentialHealth::isPermanentlyDisabled)
            .thenComparing(health -> health.lastFailureCategory() == ErrorCategory.QUOTA_EXHAUSTED)
            .thenComparing(CredentialHealth::lastUsedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(CredentialHealth::lastUsedSequence);

    private final ApiProvider provider;
    private final List<Credential> credentials;
    private final List<CredentialHealth> healthRecords;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private int nextIndex;
    private long useSequence;

    /**
     * Creates a pool over the given credentials.
     *
     * @param provider provider every credential belongs to
     * @param credentials credentials in rotation order
     * @param clock time source for cooldown decisions
     * @throws PoolConfigurationException when the list is empty, mixes providers, or repeats a secret
     */
    public CredentialPool(ApiProvider provider, List<Credential> credentials, Clock clock) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (credentials == null || credentials.isEmpty()) {
            throw new PoolConfigurationException(
                    provider, "No credentials configured for provider " + provider.getName());
        }
        Set<String> seenSecrets = new HashSet<>();
        List<CredentialHealth> records = new ArrayList<>(credentials.size());
        for (Credential credential : credentials) {
            Objects.requireNonNull(credential, "credential");
            if (credential.provider() != provider) {
                throw new PoolConfigurationException(
                        provider,
                        "Credential " + credential.maskedId() + " belongs to " + credential.provider().getName());
            }
            if (!seenSecrets.add(credential.secret())) {
                throw new PoolConfigurationException(
                        provider, "Duplicate credential " + credential.maskedId() + " for " + provider.getName());
            }
            records.add(new CredentialHealth());
        }
        this.credentials = List.copyOf(credentials);
        this.healthRecords = List.copyOf(records);
    }

    public ApiProvider provider() {
        return provider;
    }

    public int size() {
        return credentials.size();
    }

    /**
     * Returns the pooled credentials in rotation order.
     */
    public List<Credential> credentials() {
        return credentials;
    }

    /**
     * Returns the next credential in rotation order whose cooldown has passed.
     *
     * <p>The rotation cursor advances exactly once per call whatever the outcome, so repeated calls
     * sweep the pool instead of re-checking the same starting point.</p>
     *
     * @return the selected credential, or empty when every credential is cooling down
     */
    public Optional<Credential> selectNext() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int start = nextIndex;
            nextIndex = (nextIndex + 1) % credentials.size();
            for (int offset = 0; offset < credentials.size(); offset++) {
                int index = (start + offset) % credentials.size();
                CredentialHealth health = healthRecords.get(index);
                health.clearIfElapsed(now);
                if (!health.isCoolingDown(now)) {
                    health.markUsed(now, ++useSequence);
                    return Optional.of(credentials.get(index));
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a successful call: bumps the request count, clears an elapsed cooldown and stamps last use.
     */
    public void recordSuccess(Credential credential) {
        lock.lock();
        try {
            healthOf(credential).recordSuccess(clock.instant(), ++useSequence);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Disables a credential for at least {@code cooldown}; an active longer cooldown is kept.
     *
     * @param credential pooled credential
     * @param cooldown cooldown length, or null to disable for the process lifetime
     * @param category failure category that caused the disablement, may be null
     * @return the effective disabled-until instant
     */
    public Instant disable(Credential credential, Duration cooldown, ErrorCategory category) {
        if (cooldown != null && cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be non-negative");
        }
        lock.lock();
        try {
            return healthOf(credential).disable(clock.instant(), cooldown, category);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Disables a credential without recording a failure category.
     */
    public Instant disable(Credential credential, Duration cooldown) {
        return disable(credential, cooldown, null);
    }

    /**
     * Reports whether every credential is currently cooling down.
     */
    public boolean allDisabled() {
        lock.lock();
        try {
            Instant now = clock.instant();
            for (CredentialHealth health : healthRecords) {
                if (!health.isCoolingDown(now)) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports whether at least one credential is not permanently disabled.
     */
    public boolean hasRecoverableCredential() {
        lock.lock();
        try {
            for (CredentialHealth health : healthRecords) {
                if (!health.isPermanentlyDisabled()) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands out the longest-idle credential while every credential is cooling down, clearing its cooldown.
     *
     * <p>Permanently disabled credentials are only chosen when nothing else is left, and credentials
     * cooling down after quota exhaustion rank behind other cooling credentials. If a credential
     * recovered since the caller observed exhaustion, the longest-idle available one is returned
     * without touching any cooldown.</p>
     */
    public Credential forceOldestUsed() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<Integer> available = new ArrayList<>();
            for (int index = 0; index < healthRecords.size(); index++) {
                CredentialHealth health = healthRecords.get(index);
                health.clearIfElapsed(now);
                if (!health.isCoolingDown(now)) {
                    available.add(index);
                }
            }
            List<Integer> candidates = available;
            if (candidates.isEmpty()) {
                candidates = new ArrayList<>();
                for (int index = 0; index < healthRecords.size(); index++) {
                    candidates.add(index);
                }
            }
            int chosen = candidates.get(0);
            for (int candidate : candidates) {
                if (FORCED_REUSE_ORDER.compare(healthRecords.get(candidate), healthRecords.get(chosen)) < 0) {
                    chosen = candidate;
                }
            }
            CredentialHealth health = healthRecords.get(chosen);
            if (health.isCoolingDown(now)) {
                log.debug("[{}] Clearing cooldown of {} for forced reuse (was until {})",
                        provider.getName(), credentials.get(chosen).maskedId(), health.disabledUntil());
                health.clearDisablement();
            }
            health.markUsed(now, ++useSequence);
            return credentials.get(chosen);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of every credential in rotation order.
     */
    public List<CredentialSnapshot> snapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<CredentialSnapshot> snapshots = new ArrayList<>(credentials.size());
            for (int index = 0; index < credentials.size(); index++) {
                snapshots.add(healthRecords.get(index).snapshot(credentials.get(index).maskedId(), now));
            }
            return List.copyOf(snapshots);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the snapshot of one credential.
     */
    public CredentialSnapshot snapshotOf(Credential credential) {
        lock.lock();
        try {
            return healthOf(credential).snapshot(credential.maskedId(), clock.instant());
        } finally {
            lock.unlock();
        }
    }

    private CredentialHealth healthOf(Credential credential) {
        Objects.requireNonNull(credential, "credential");
        for (int index = 0; index < credentials.size(); index++) {
            if (credentials.get(index) == credential) {
                return healthRecords.get(index);
            }
        }
        throw new IllegalArgumentException(
                "Credential " + credential.maskedId() + " is not part of the " + provider.getName() + " pool");
    }
}
