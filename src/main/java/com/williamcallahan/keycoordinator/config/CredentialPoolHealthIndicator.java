package com.williamcallahan.keycoordinator.config;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.credential.CredentialSnapshot;
import com.williamcallahan.keycoordinator.service.credential.CredentialPoolRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Spring Actuator health indicator for the credential pools.
 *
 * <p>Reports DOWN when any configured provider has every key cooling down, and lists per-provider
 * available key counts. Unconfigured providers are reported but do not affect the status.</p>
 */
@Component
public class CredentialPoolHealthIndicator implements HealthIndicator {

    private static final String DETAIL_KEY_UNAVAILABLE = "unavailable";

    private final CredentialPoolRegistry credentialPoolRegistry;

    public CredentialPoolHealthIndicator(CredentialPoolRegistry credentialPoolRegistry) {
        this.credentialPoolRegistry = credentialPoolRegistry;
    }

    @Override
    public Health health() {
        boolean anyExhausted = false;
        Map<String, Object> providerDetails = new LinkedHashMap<>();
        for (Map.Entry<ApiProvider, List<CredentialSnapshot>> entry :
                credentialPoolRegistry.snapshots().entrySet()) {
            List<CredentialSnapshot> snapshots = entry.getValue();
            long available = snapshots.stream().filter(snapshot -> !snapshot.disabled()).count();
            if (available == 0) {
                anyExhausted = true;
            }
            providerDetails.put(entry.getKey().getName(), available + "/" + snapshots.size() + " keys available");
        }

        Health.Builder builder = anyExhausted ? Health.down() : Health.up();
        builder.withDetails(providerDetails);
        if (!credentialPoolRegistry.unavailableReasons().isEmpty()) {
            Map<String, String> unavailable = new LinkedHashMap<>();
            credentialPoolRegistry.unavailableReasons()
                    .forEach((provider, reason) -> unavailable.put(provider.getName(), reason));
            builder.withDetail(DETAIL_KEY_UNAVAILABLE, unavailable);
        }
        return builder.build();
    }
}
