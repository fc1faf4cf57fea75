package com.williamcallahan.keycoordinator.service.credential;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the credential for the next attempt, degrading to forced reuse instead of failing.
 *
 * <p>Callers never observe pool exhaustion: when every key is cooling down the longest-idle one is
 * handed out and flagged so the caller can back off before using it.</p>
 */
@Component
public class CredentialSelector {
    private static final Logger log = LoggerFactory.getLogger(CredentialSelector.class);

    /**
     * Selects a credential from the pool.
     *
     * @param pool provider pool
     * @return the selection, never null
     */
    public CredentialSelection next(CredentialPool pool) {
        return pool.selectNext()
                .map(credential -> {
                    log.debug("[{}] Selected key {}", pool.provider().getName(), credential.maskedId());
                    return new CredentialSelection(credential, false);
                })
                .orElseGet(() -> {
                    Credential reused = pool.forceOldestUsed();
                    log.warn("[{}] All {} keys cooling down; forcing reuse of {}",
                            pool.provider().getName(), pool.size(), reused.maskedId());
                    return new CredentialSelection(reused, true);
                });
    }
}
