package com.williamcallahan.keycoordinator.web;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.credential.CredentialSnapshot;
import com.williamcallahan.keycoordinator.domain.ratelimit.RateLimitStatus;
import com.williamcallahan.keycoordinator.service.credential.CredentialPool;
import com.williamcallahan.keycoordinator.service.credential.CredentialPoolRegistry;
import com.williamcallahan.keycoordinator.service.ratelimit.WindowRateLimiter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Diagnostics endpoints for credential pools and rate-limit windows. Secrets are always masked.
 */
@RestController
@RequestMapping("/api/admin")
public class CredentialStatsController {

    private final CredentialPoolRegistry credentialPoolRegistry;
    private final WindowRateLimiter windowRateLimiter;

    public CredentialStatsController(
            CredentialPoolRegistry credentialPoolRegistry, WindowRateLimiter windowRateLimiter) {
        this.credentialPoolRegistry = credentialPoolRegistry;
        this.windowRateLimiter = windowRateLimiter;
    }

    @GetMapping("/credentials")
    public CredentialStatsResponse credentials() {
        Map<String, List<CredentialSnapshot>> providers = new LinkedHashMap<>();
        credentialPoolRegistry.snapshots().forEach((provider, snapshots) -> providers.put(provider.getName(), snapshots));
        Map<String, String> unavailable = new LinkedHashMap<>();
        credentialPoolRegistry.unavailableReasons().forEach((provider, reason) -> unavailable.put(provider.getName(), reason));
        return CredentialStatsResponse.success(providers, unavailable);
    }

    /**
     * Returns the snapshot of one provider's pool.
     *
     * @param providerName provider name such as {@code gemini}
     */
    @GetMapping("/credentials/{provider}")
    public ProviderCredentialsResponse providerCredentials(@PathVariable("provider") String providerName) {
        ApiProvider provider = ApiProvider.fromName(providerName);
        CredentialPool pool = credentialPoolRegistry.poolFor(provider);
        List<CredentialSnapshot> snapshots = pool.snapshot();
        long available = snapshots.stream().filter(snapshot -> !snapshot.disabled()).count();
        return ProviderCredentialsResponse.success(provider.getName(), pool.size(), available, snapshots);
    }

    /**
     * Reports rate-limit windows for a caller without consuming budget.
     *
     * @param resource resource name; all configured resources when omitted
     * @param identifier caller key
     */
    @GetMapping("/rate-limits")
    public List<RateLimitStatus> rateLimits(
            @RequestParam(value = "resource", required = false) String resource,
            @RequestParam("identifier") String identifier) {
        if (resource != null && !resource.isBlank()) {
            return List.of(windowRateLimiter.status(resource.trim(), identifier));
        }
        List<RateLimitStatus> statuses = new ArrayList<>();
        for (String configured : windowRateLimiter.resources()) {
            statuses.add(windowRateLimiter.status(configured, identifier));
        }
        statuses.sort((first, second) -> first.resource().compareTo(second.resource()));
        return statuses;
    }
}
