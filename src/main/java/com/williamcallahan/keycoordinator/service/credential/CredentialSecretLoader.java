package com.williamcallahan.keycoordinator.service.credential;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertySource;

/**
 * Discovers API keys for a provider from explicit configuration and environment variables.
 *
 * <p>For a prefix such as {@code CEREBRAS_API_KEY} the loader reads {@code CEREBRAS_API_KEY} and
 * every numbered variant {@code CEREBRAS_API_KEY_1}, {@code CEREBRAS_API_KEY_2}, and so on. Explicit
 * keys come first, then the bare prefix, then numbered variants in ascending order. A secret that
 * appears more than once is kept only at its first position.</p>
 */
public class CredentialSecretLoader {
    private static final Logger log = LoggerFactory.getLogger(CredentialSecretLoader.class);

    /** Numbered suffixes probed directly, for property sources that cannot be enumerated. */
    static final int MAX_PROBED_SUFFIX = 20;

    private final Environment environment;

    public CredentialSecretLoader(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * Loads the credentials for a provider.
     *
     * @param provider provider the keys belong to
     * @param envPrefix environment variable prefix to scan
     * @param explicitKeys keys configured directly, may be null
     * @return credentials in rotation order, possibly empty
     */
    public List<Credential> load(ApiProvider provider, String envPrefix, List<String> explicitKeys) {
        Objects.requireNonNull(provider, "provider");
        List<Credential> credentials = new ArrayList<>();
        Set<String> seenSecrets = new HashSet<>();

        if (explicitKeys != null) {
            for (int index = 0; index < explicitKeys.size(); index++) {
                addIfNew(credentials, seenSecrets, provider,
                        "app.providers." + provider.getName() + ".keys[" + index + "]", explicitKeys.get(index));
            }
        }
        if (envPrefix != null && !envPrefix.isBlank()) {
            for (String name : discoverVariableNames(envPrefix.trim())) {
                addIfNew(credentials, seenSecrets, provider, name, environment.getProperty(name));
            }
        }
        return credentials;
    }

    /**
     * Returns the bare prefix followed by numbered variants in ascending order.
     */
    List<String> discoverVariableNames(String prefix) {
        Pattern numbered = Pattern.compile(Pattern.quote(prefix) + "_(\\d+)");
        TreeMap<Integer, String> numberedNames = new TreeMap<>();
        for (int suffix = 1; suffix <= MAX_PROBED_SUFFIX; suffix++) {
            String candidate = prefix + "_" + suffix;
            if (environment.containsProperty(candidate)) {
                numberedNames.put(suffix, candidate);
            }
        }
        if (environment instanceof ConfigurableEnvironment configurable) {
            for (PropertySource<?> source : configurable.getPropertySources()) {
                if (source instanceof EnumerablePropertySource<?> enumerable) {
                    for (String name : enumerable.getPropertyNames()) {
                        Matcher matcher = numbered.matcher(name);
                        if (matcher.matches() && matcher.group(1).length() < 10) {
                            numberedNames.putIfAbsent(Integer.parseInt(matcher.group(1)), name);
                        }
                    }
                }
            }
        }
        List<String> names = new ArrayList<>();
        if (environment.containsProperty(prefix)) {
            names.add(prefix);
        }
        names.addAll(numberedNames.values());
        return names;
    }

    private void addIfNew(
            List<Credential> credentials, Set<String> seenSecrets, ApiProvider provider, String sourceName, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return;
        }
        String secret = rawValue.trim();
        if (!seenSecrets.add(secret)) {
            log.warn("[{}] Ignoring duplicate key from {}", provider.getName(), sourceName);
            return;
        }
        credentials.add(new Credential(provider, sourceName, secret));
    }
}
