package com.agencyos.searchsync.redis;

import com.agencyos.searchsync.core.model.StreamEntry;
import com.agencyos.searchsync.core.stream.StreamChannel;
import com.agencyos.searchsync.core.stream.StreamConnector;
import com.agencyos.searchsync.core.stream.StreamEndpoint;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisChannelHandler;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisConnectionStateListener;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.SslVerifyMode;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Redis stream transport built on Lettuce.
 *
 * <h2>Connection handling</h2>
 * <ul>
 *   <li>Lettuce auto-reconnect is switched off and commands are rejected while disconnected, so a dropped
 *       connection surfaces immediately as a lost channel instead of silently queueing appends.</li>
 *   <li>{@code rediss://} endpoints use TLS. Peer verification follows {@code verifyPeer}; turning it off
 *       accepts any certificate and is logged as a warning.</li>
 *   <li>One {@link RedisClient} and one set of {@link ClientResources} are reused for every connect attempt
 *       and released by {@link #shutdown()}.</li>
 * </ul>
 *
 * <h2>Append</h2>
 * {@code XADD <stream> * action .. tenant .. entity_type .. entity_id .. collection .. timestamp ..};
 * the entry id is the id Redis generates.
 */
public class RedisStreamConnector implements StreamConnector {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamConnector.class);

    private final StreamEndpoint endpoint;
    private final String stream;
    private final RedisURI uri;
    private final ClientResources resources;
    private final RedisClient client;

    /**
     * Live channels keyed by their Lettuce connection, so client-wide callbacks can be routed.
     * The listener sees the connection as a {@link RedisChannelHandler} while {@code connectAsync}
     * hands out the {@link StatefulRedisConnection} view of the same object, hence the identity key.
     */
    private final Map<Object, RedisStreamChannel> channels = new ConcurrentHashMap<>();

    public RedisStreamConnector(StreamEndpoint endpoint, String stream, boolean verifyPeer, Duration connectTimeout) {
        if (endpoint.transport() != StreamEndpoint.Transport.REDIS) {
            throw new IllegalArgumentException("Not a Redis endpoint: " + endpoint.masked());
        }
        this.endpoint = endpoint;
        this.stream = Objects.requireNonNull(stream, "stream");

        this.uri = RedisURI.create(endpoint.url());
        this.uri.setTimeout(connectTimeout);
        if (endpoint.secure()) {
            this.uri.setSsl(true);
            this.uri.setVerifyPeer(verifyPeer ? SslVerifyMode.FULL : SslVerifyMode.NONE);
            if (!verifyPeer) {
                log.warn("Search sync: TLS certificate verification disabled for endpoint={}", endpoint.masked());
            }
        }

        this.resources = DefaultClientResources.create();
        this.client = RedisClient.create(resources, uri);
        this.client.setOptions(ClientOptions.builder()
                .autoReconnect(false)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .socketOptions(SocketOptions.builder().connectTimeout(connectTimeout).build())
                .build());
        this.client.addListener(new ChannelRouter());

        log.info("Search sync: using Redis stream transport endpoint={} stream={} tls={}",
                endpoint.masked(), stream, endpoint.secure());
    }

    @Override
    public Mono<StreamChannel> connect(Consumer<Throwable> onConnectionLost) {
        return Mono.fromCompletionStage(() -> client.connectAsync(StringCodec.UTF8, uri))
                .map(conn -> register(conn, onConnectionLost));
    }

    StreamChannel register(StatefulRedisConnection<String, String> conn, Consumer<Throwable> onConnectionLost) {
        RedisStreamChannel ch = new RedisStreamChannel(conn, stream, onConnectionLost);
        channels.put(conn, ch);
        // Closed while we were registering: no disconnect callback will route to it.
        if (!conn.isOpen()) {
            channels.remove(conn);
            ch.fireLost(null);
        }
        return ch;
    }

    void routeDisconnect(Object connection) {
        RedisStreamChannel ch = channels.remove(connection);
        if (ch != null) {
            ch.fireLost(null);
        }
    }

    void routeException(Object connection, Throwable cause) {
        RedisStreamChannel ch = channels.get(connection);
        if (ch != null) {
            ch.rememberCause(cause);
        }
    }

    int liveChannels() {
        return channels.size();
    }

    @Override
    public void shutdown() {
        channels.values().forEach(RedisStreamChannel::close);
        channels.clear();
        client.shutdownAsync()
                .whenComplete((v, err) -> resources.shutdown());
    }

    public StreamEndpoint endpoint() {
        return endpoint;
    }

    private final class ChannelRouter implements RedisConnectionStateListener {

        @Override
        public void onRedisDisconnected(RedisChannelHandler<?, ?> connection) {
            routeDisconnect(connection);
        }

        @Override
        public void onRedisExceptionCaught(RedisChannelHandler<?, ?> connection, Throwable cause) {
            routeException(connection, cause);
        }
    }

    /**
     * One Lettuce connection; appends go through its reactive command API.
     */
    static final class RedisStreamChannel implements StreamChannel {

        private final StatefulRedisConnection<String, String> connection;
        private final String stream;
        private final Consumer<Throwable> onConnectionLost;

        private boolean lost;
        private boolean closed;
        private volatile Throwable lastCause;

        RedisStreamChannel(StatefulRedisConnection<String, String> connection, String stream,
                           Consumer<Throwable> onConnectionLost) {
            this.connection = connection;
            this.stream = stream;
            this.onConnectionLost = onConnectionLost;
        }

        @Override
        public Mono<String> append(StreamEntry entry) {
            return connection.reactive().xadd(stream, entry.toFields());
        }

        void rememberCause(Throwable cause) {
            this.lastCause = cause;
        }

        void fireLost(Throwable cause) {
            synchronized (this) {
                if (lost) {
                    return;
                }
                lost = true;
            }
            onConnectionLost.accept(cause != null ? cause : lastCause);
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            // The disconnect caused by our own close is not a loss.
            lost = true;
            // Async: this can run on a Netty I/O thread.
            connection.closeAsync();
        }
    }
}
