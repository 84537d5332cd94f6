package com.agencyos.searchsync.jetstream;

import com.agencyos.searchsync.core.model.StreamEntry;
import com.agencyos.searchsync.core.stream.StreamChannel;
import com.agencyos.searchsync.core.stream.StreamConnector;
import com.agencyos.searchsync.core.stream.StreamEndpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.JetStream;
import io.nats.client.Message;
import io.nats.client.Nats;
import io.nats.client.Options;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * NATS JetStream transport.
 *
 * <h2>Purpose</h2>
 * Lets deployments that already run NATS feed the indexer from a JetStream stream instead of Redis.
 * The stream itself (capturing the configured subject) is provisioned outside this service.
 *
 * <h2>Connection strategy</h2>
 * <ul>
 *   <li>{@code nats://} connects in plain text; {@code tls://} enables TLS. With peer verification off the
 *       client trusts any certificate ({@code opentls}) and a warning is logged.</li>
 *   <li>Credentials embedded in the URL are handled by jNATS; a {@code .creds} file may be supplied for
 *       NKey/JWT auth.</li>
 *   <li>jNATS reconnect is disabled ({@code noReconnect}); the connection manager owns retries.</li>
 *   <li>{@link Nats#connect(Options)} blocks, so it runs on {@link Schedulers#boundedElastic()}.</li>
 * </ul>
 *
 * <h2>Message format</h2>
 * Each entry is one message on the configured subject. The six wire fields are carried both as headers
 * and as a flat JSON object body. The entry id is the JetStream sequence number from the publish ack.
 */
public class JetStreamConnector implements StreamConnector {

    private static final Logger log = LoggerFactory.getLogger(JetStreamConnector.class);

    private final StreamEndpoint endpoint;
    private final String subject;
    private final boolean verifyPeer;
    private final Duration connectTimeout;
    private final String credsFile;
    private final ObjectMapper mapper;

    private final Map<Connection, JetStreamChannel> channels = new ConcurrentHashMap<>();

    public JetStreamConnector(StreamEndpoint endpoint, String subject, boolean verifyPeer, Duration connectTimeout,
                              String credsFile, ObjectMapper mapper) {
        if (endpoint.transport() != StreamEndpoint.Transport.JETSTREAM) {
            throw new IllegalArgumentException("Not a NATS endpoint: " + endpoint.masked());
        }
        this.endpoint = endpoint;
        this.subject = Objects.requireNonNull(subject, "subject");
        this.verifyPeer = verifyPeer;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.credsFile = credsFile == null || credsFile.isBlank() ? null : credsFile.trim();
        this.mapper = Objects.requireNonNull(mapper, "mapper");

        if (endpoint.secure() && !verifyPeer) {
            log.warn("Search sync: TLS certificate verification disabled for endpoint={}", endpoint.masked());
        }
        log.info("Search sync: using JetStream transport endpoint={} subject={} tls={} creds={}",
                endpoint.masked(), subject, endpoint.secure(), this.credsFile == null ? "" : this.credsFile);
    }

    @Override
    public Mono<StreamChannel> connect(Consumer<Throwable> onConnectionLost) {
        return Mono.fromCallable(() -> {
                    Connection nc = Nats.connect(buildOptions());
                    return register(nc, nc.jetStream(), onConnectionLost);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    StreamChannel register(Connection nc, JetStream js, Consumer<Throwable> onConnectionLost) {
        JetStreamChannel ch = new JetStreamChannel(nc, js, subject, mapper, onConnectionLost);
        channels.put(nc, ch);
        // Dropped before the listener could see the channel.
        if (nc.getStatus() != Connection.Status.CONNECTED) {
            channels.remove(nc);
            ch.fireLost(null);
        }
        return ch;
    }

    int liveChannels() {
        return channels.size();
    }

    Options buildOptions() throws Exception {
        Options.Builder b = new Options.Builder()
                .server(endpoint.url())
                .connectionTimeout(connectTimeout)
                .noReconnect()
                .connectionListener(this::onConnectionEvent);

        if (endpoint.secure()) {
            if (verifyPeer) {
                b.secure();
            } else {
                b.opentls();
            }
        }
        if (credsFile != null) {
            b.authHandler(Nats.credentials(credsFile));
        }
        return b.build();
    }

    void onConnectionEvent(Connection conn, ConnectionListener.Events type) {
        if (type == ConnectionListener.Events.DISCONNECTED || type == ConnectionListener.Events.CLOSED) {
            JetStreamChannel ch = channels.remove(conn);
            if (ch != null) {
                Throwable cause = conn.getLastError() == null ? null : new IllegalStateException(conn.getLastError());
                ch.fireLost(cause);
            }
        }
    }

    @Override
    public void shutdown() {
        channels.values().forEach(JetStreamChannel::close);
        channels.clear();
    }

    /**
     * One NATS connection with its JetStream context.
     */
    static final class JetStreamChannel implements StreamChannel {

        private final Connection connection;
        private final JetStream js;
        private final String subject;
        private final ObjectMapper mapper;
        private final Consumer<Throwable> onConnectionLost;

        private boolean lost;
        private boolean closed;

        JetStreamChannel(Connection connection, JetStream js, String subject, ObjectMapper mapper,
                         Consumer<Throwable> onConnectionLost) {
            this.connection = connection;
            this.js = js;
            this.subject = subject;
            this.mapper = mapper;
            this.onConnectionLost = onConnectionLost;
        }

        @Override
        public Mono<String> append(StreamEntry entry) {
            return Mono.fromCallable(() -> toMessage(entry))
                    .flatMap(msg -> Mono.fromFuture(() -> js.publishAsync(msg)))
                    .map(ack -> Long.toString(ack.getSeqno()));
        }

        private Message toMessage(StreamEntry entry) throws Exception {
            Map<String, String> fields = entry.toFields();
            Headers headers = new Headers();
            fields.forEach((k, v) -> headers.add(k, v));
            return NatsMessage.builder()
                    .subject(subject)
                    .headers(headers)
                    .data(mapper.writeValueAsBytes(fields))
                    .build();
        }

        void fireLost(Throwable cause) {
            synchronized (this) {
                if (lost) {
                    return;
                }
                lost = true;
            }
            onConnectionLost.accept(cause);
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            lost = true;
            // close() blocks until the connection drains; keep it off the caller's thread.
            Schedulers.boundedElastic().schedule(() -> {
                try {
                    connection.close();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
    }
}
