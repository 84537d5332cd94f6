package com.agencyos.searchsync.core.stream;

import java.util.Locale;
import java.util.Objects;

/**
 * Parsed streaming-store endpoint.
 *
 * <h2>Supported schemes</h2>
 * <pre>
 * redis://   Redis stream, plain TCP
 * rediss://  Redis stream, TLS
 * nats://    NATS JetStream, plain TCP
 * tls://     NATS JetStream, TLS
 * </pre>
 *
 * <p>The secure flag is derived from the scheme only. Whether certificates are verified is a separate
 * setting owned by the connector.</p>
 */
public final class StreamEndpoint {

    public enum Transport { REDIS, JETSTREAM }

    private final String url;
    private final String scheme;
    private final Transport transport;
    private final boolean secure;

    private StreamEndpoint(String url, String scheme, Transport transport, boolean secure) {
        this.url = url;
        this.scheme = scheme;
        this.transport = transport;
        this.secure = secure;
    }

    /**
     * Parses an endpoint URL.
     *
     * @throws IllegalArgumentException if the URL is blank, malformed, or uses an unsupported scheme
     */
    public static StreamEndpoint parse(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new IllegalArgumentException("Stream endpoint URL is required");
        }
        String url = rawUrl.trim();
        int sep = url.indexOf("://");
        if (sep <= 0) {
            throw new IllegalArgumentException("Stream endpoint has no scheme (expected redis://, rediss://, nats:// or tls://)");
        }
        String scheme = url.substring(0, sep).toLowerCase(Locale.ROOT);
        return switch (scheme) {
            case "redis" -> new StreamEndpoint(url, scheme, Transport.REDIS, false);
            case "rediss" -> new StreamEndpoint(url, scheme, Transport.REDIS, true);
            case "nats" -> new StreamEndpoint(url, scheme, Transport.JETSTREAM, false);
            case "tls" -> new StreamEndpoint(url, scheme, Transport.JETSTREAM, true);
            default -> throw new IllegalArgumentException(
                    "Unsupported stream endpoint scheme '" + scheme + "'. Valid schemes=[redis, rediss, nats, tls]");
        };
    }

    /** Full URL including credentials. Never log this; use {@link #masked()}. */
    public String url() {
        return url;
    }

    public String scheme() {
        return scheme;
    }

    public Transport transport() {
        return transport;
    }

    public boolean secure() {
        return secure;
    }

    /**
     * @return the URL with any password in the userinfo replaced by {@code ***}
     */
    public String masked() {
        return mask(url);
    }

    /**
     * Userinfo runs from the scheme separator to the <em>last</em> {@code '@'}. Passwords copied from
     * hosted consoles often contain {@code '@'} or {@code '/'}, which {@link java.net.URI} would read as a
     * registry authority without userinfo, so the split is done by hand. An {@code '@'} further right
     * (in a query, say) only widens the masked part.
     */
    static String mask(String url) {
        int sep = url.indexOf("://");
        if (sep < 0) {
            return url;
        }
        int start = sep + 3;
        int at = url.lastIndexOf('@');
        if (at < start) {
            return url;
        }
        String userInfo = url.substring(start, at);
        int colon = userInfo.indexOf(':');
        String maskedInfo = colon >= 0 ? userInfo.substring(0, colon) + ":***" : "***";
        return url.substring(0, start) + maskedInfo + url.substring(at);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamEndpoint other)) return false;
        return url.equals(other.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url);
    }

    @Override
    public String toString() {
        return masked();
    }
}
