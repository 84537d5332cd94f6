package com.agencyos.searchsync.config;

import com.agencyos.searchsync.core.collection.CollectionClassifier;
import com.agencyos.searchsync.core.connection.ReconnectPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Search sync configuration.
 *
 * <h2>Binding</h2>
 * Bound from Spring Boot config using the prefix {@code searchsync}, e.g.:
 * <pre>
 * searchsync:
 *   url: ${REDIS_URL:}              # canonical endpoint key; blank disables publishing
 *   stream: search:sync
 *   suffixes: [_products, _categories]
 *   max-retries: 5
 *   backoff-step: 200ms
 *   backoff-cap: 2000ms
 *   tls:
 *     verify-peer: true
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>The endpoint may carry a password. It is masked in every log line and status response.</li>
 *   <li>A missing endpoint is a valid configuration: the service runs and publishes nothing.</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "searchsync")
public class SearchSyncProperties {

    // ---------------------------------------------------------------------
    // Endpoint
    // ---------------------------------------------------------------------

    /**
     * Streaming store endpoint: {@code redis://}, {@code rediss://}, {@code nats://} or {@code tls://}.
     *
     * <p><b>Default</b>: unset (publishing disabled)</p>
     */
    private String url;

    /**
     * Extra environment keys consulted, in order, when {@link #url} is blank.
     *
     * <p>Off by default. Exists for hosts that still export the endpoint under an older name,
     * e.g. {@code REDIS_CONNECTION_STRING}.</p>
     */
    private List<String> fallbackUrlKeys = new ArrayList<>();

    /**
     * When no endpoint is found, log the names (never the values) of the available environment keys.
     */
    private boolean logAvailableKeysWhenMissing = false;

    /**
     * Redis stream key, or JetStream subject.
     */
    @NotBlank
    private String stream = "search:sync";

    // ---------------------------------------------------------------------
    // Classification
    // ---------------------------------------------------------------------

    /**
     * Ordered collection-name suffixes that mark a collection as searchable. First match wins.
     */
    @NotEmpty
    private List<String> suffixes = new ArrayList<>(CollectionClassifier.DEFAULT_SUFFIXES);

    // ---------------------------------------------------------------------
    // Reconnect / timeouts
    // ---------------------------------------------------------------------

    /** Consecutive connect failures tolerated before publishing is disabled. */
    @Min(0)
    private int maxRetries = ReconnectPolicy.DEFAULT_MAX_RETRIES;

    /** Linear backoff step between connect attempts. */
    @NotNull
    @DurationMin(nanos = 1)
    private Duration backoffStep = ReconnectPolicy.DEFAULT_STEP;

    /** Upper bound for the backoff delay. */
    @NotNull
    @DurationMin(nanos = 1)
    private Duration backoffCap = ReconnectPolicy.DEFAULT_CAP;

    /** Timeout of a single connect attempt. */
    @NotNull
    @DurationMin(nanos = 1)
    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Timeout of a single append; a timed-out append counts as failed and is dropped. */
    @NotNull
    @DurationMin(nanos = 1)
    private Duration appendTimeout = Duration.ofSeconds(5);

    @Valid
    private Tls tls = new Tls();

    @Valid
    private JetStream jetstream = new JetStream();

    @Valid
    private Admin admin = new Admin();

    /**
     * @return reconnect policy built from the retry/backoff settings
     * @throws IllegalArgumentException if the durations are inconsistent
     */
    public ReconnectPolicy reconnectPolicy() {
        return new ReconnectPolicy(maxRetries, backoffStep, backoffCap);
    }

    public static class Tls {

        /**
         * Verify the server certificate on {@code rediss://} and {@code tls://} endpoints.
         *
         * <p><b>Default</b>: {@code true}. Managed Redis offerings with self-signed chains may need
         * {@code false}; that accepts any certificate and is logged as a warning on startup.</p>
         */
        private boolean verifyPeer = true;

        public boolean isVerifyPeer() { return verifyPeer; }
        public void setVerifyPeer(boolean verifyPeer) { this.verifyPeer = verifyPeer; }
    }

    public static class JetStream {

        /** Optional path to a NATS {@code .creds} file (NKey/JWT auth). */
        private String credsFile;

        public String getCredsFile() { return credsFile; }
        public void setCredsFile(String credsFile) { this.credsFile = credsFile; }
    }

    public static class Admin {

        /** Exposes {@code /admin/search-sync}. Protect it with network controls when enabled. */
        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    // ---------------------------------------------------------------------
    // Getters / setters for Spring Boot binding
    // ---------------------------------------------------------------------

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public List<String> getFallbackUrlKeys() { return fallbackUrlKeys; }
    public void setFallbackUrlKeys(List<String> fallbackUrlKeys) { this.fallbackUrlKeys = fallbackUrlKeys; }

    public boolean isLogAvailableKeysWhenMissing() { return logAvailableKeysWhenMissing; }
    public void setLogAvailableKeysWhenMissing(boolean v) { this.logAvailableKeysWhenMissing = v; }

    public String getStream() { return stream; }
    public void setStream(String stream) { this.stream = stream; }

    public List<String> getSuffixes() { return suffixes; }
    public void setSuffixes(List<String> suffixes) { this.suffixes = suffixes; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Duration getBackoffStep() { return backoffStep; }
    public void setBackoffStep(Duration backoffStep) { this.backoffStep = backoffStep; }

    public Duration getBackoffCap() { return backoffCap; }
    public void setBackoffCap(Duration backoffCap) { this.backoffCap = backoffCap; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getAppendTimeout() { return appendTimeout; }
    public void setAppendTimeout(Duration appendTimeout) { this.appendTimeout = appendTimeout; }

    @AssertTrue(message = "backoff-cap must not be shorter than backoff-step")
    public boolean isBackoffCapAtLeastStep() {
        return backoffStep == null || backoffCap == null || backoffCap.compareTo(backoffStep) >= 0;
    }

    public Tls getTls() { return tls; }
    public void setTls(Tls tls) { this.tls = tls; }

    public JetStream getJetstream() { return jetstream; }
    public void setJetstream(JetStream jetstream) { this.jetstream = jetstream; }

    public Admin getAdmin() { return admin; }
    public void setAdmin(Admin admin) { this.admin = admin; }
}
