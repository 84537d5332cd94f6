package com.agencyos.searchsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Finds the streaming-store endpoint in the Spring {@link Environment}.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li>{@code searchsync.url} (canonical; {@code application.yml} maps it from {@code REDIS_URL})</li>
 *   <li>each key listed in {@code searchsync.fallback-url-keys}, in order</li>
 * </ol>
 *
 * <p>Works directly on the environment so it can run inside a {@code Condition}, before
 * {@link SearchSyncProperties} is bound.</p>
 */
public final class EndpointResolver {

    private static final Logger log = LoggerFactory.getLogger(EndpointResolver.class);

    public static final String URL_KEY = "searchsync.url";
    public static final String FALLBACK_KEYS_KEY = "searchsync.fallback-url-keys";
    public static final String LOG_KEYS_KEY = "searchsync.log-available-keys-when-missing";

    private EndpointResolver() {}

    /**
     * Endpoint URL and the key it was read from.
     */
    public record Resolved(String url, String key) {}

    public static Optional<Resolved> resolve(Environment env) {
        String canonical = env.getProperty(URL_KEY);
        if (canonical != null && !canonical.isBlank()) {
            return Optional.of(new Resolved(canonical.trim(), URL_KEY));
        }
        for (String key : fallbackKeys(env)) {
            if (key == null || key.isBlank()) {
                continue;
            }
            String v = env.getProperty(key.trim());
            if (v != null && !v.isBlank()) {
                return Optional.of(new Resolved(v.trim(), key.trim()));
            }
        }
        return Optional.empty();
    }

    /**
     * Logs that publishing is disabled and, when enabled, the names of the available environment keys.
     */
    public static void logMissing(Environment env) {
        log.info("Search sync: no stream endpoint configured ({} and fallbacks {} are blank), change publishing disabled",
                URL_KEY, fallbackKeys(env));
        if (env.getProperty(LOG_KEYS_KEY, Boolean.class, false)) {
            log.info("Search sync: available environment keys: {}", String.join(", ", environmentKeyNames(env)));
        }
    }

    static List<String> fallbackKeys(Environment env) {
        return Binder.get(env)
                .bind(FALLBACK_KEYS_KEY, Bindable.listOf(String.class))
                .orElse(List.of());
    }

    private static TreeSet<String> environmentKeyNames(Environment env) {
        TreeSet<String> names = new TreeSet<>();
        if (env instanceof ConfigurableEnvironment ce) {
            PropertySource<?> ps = ce.getPropertySources()
                    .get(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME);
            if (ps instanceof EnumerablePropertySource<?> eps) {
                names.addAll(Arrays.asList(eps.getPropertyNames()));
            }
        }
        return names;
    }
}
