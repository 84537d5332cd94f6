package com.agencyos.searchsync.core.connection;

import com.agencyos.searchsync.core.model.ConnectionSnapshot;
import com.agencyos.searchsync.core.model.ConnectionState;
import com.agencyos.searchsync.core.stream.StreamChannel;
import com.agencyos.searchsync.core.stream.StreamConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the single connection to the streaming store and its connect/retry/disable state machine.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>{@link #start()} returns immediately; the first attempt runs on the timer scheduler.</li>
 *   <li>A failed attempt is retried after {@link ReconnectPolicy#delayAfter(int)}; once the policy is
 *       exhausted the manager moves to {@link ConnectionState#DISABLED} and never tries again.</li>
 *   <li>A transport error on a live connection moves to {@link ConnectionState#DISCONNECTED} and
 *       immediately starts a new connect cycle with a fresh failure counter.</li>
 *   <li>The failure counter resets only when a connect succeeds.</li>
 * </ul>
 *
 * <h2>Logging</h2>
 * Edge-triggered, one line per outage transition:
 * <ul>
 *   <li>ERROR when a live connection is lost. That line also opens the reconnect cycle, so failed
 *       reconnects after it stay at DEBUG.</li>
 *   <li>WARN when a cycle not started by a loss (the initial one) first fails.</li>
 *   <li>WARN once when the manager disables itself.</li>
 * </ul>
 * Every other failed attempt logs at DEBUG only.
 *
 * <h2>Threading</h2>
 * Transitions are serialized on this instance; callbacks may arrive from client I/O threads or the timer
 * scheduler. Readers ({@link #isAvailable()}, {@link #availableChannel()}) never block.
 * Each scheduled attempt carries a generation number so callbacks from superseded attempts or channels
 * are ignored.
 */
public final class ConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final StreamConnector connector;
    private final ReconnectPolicy policy;
    private final Scheduler timer;
    private final String endpointLabel;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile StreamChannel channel;
    private volatile String lastError;
    private volatile int consecutiveFailures;
    private volatile long totalAttempts;

    private long generation;
    private long lostBeforeReady = -1;
    /** The current outage already has its WARN/ERROR line; cleared on connect. */
    private boolean outageReported;
    private Disposable pendingAttempt;
    private boolean closed;

    public ConnectionManager(StreamConnector connector, ReconnectPolicy policy, String endpointLabel) {
        this(connector, policy, endpointLabel, Schedulers.parallel());
    }

    /**
     * @param timer scheduler for backoff delays; tests pass a virtual-time scheduler
     */
    public ConnectionManager(StreamConnector connector, ReconnectPolicy policy, String endpointLabel, Scheduler timer) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.endpointLabel = endpointLabel == null ? "" : endpointLabel;
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    /**
     * Begins connecting in the background. Idempotent; has no effect once disabled or closed.
     */
    public synchronized void start() {
        if (closed || state != ConnectionState.DISCONNECTED) {
            return;
        }
        state = ConnectionState.CONNECTING;
        scheduleAttempt(Duration.ZERO);
    }

    public boolean isAvailable() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * @return the live channel when connected, otherwise empty
     */
    public Optional<StreamChannel> availableChannel() {
        StreamChannel ch = channel;
        if (ch == null || state != ConnectionState.CONNECTED) {
            return Optional.empty();
        }
        return Optional.of(ch);
    }

    public ConnectionState state() {
        return state;
    }

    public ConnectionSnapshot snapshot() {
        return new ConnectionSnapshot(state, consecutiveFailures, totalAttempts, lastError);
    }

    public ReconnectPolicy policy() {
        return policy;
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    private synchronized void scheduleAttempt(Duration delay) {
        final long gen = ++generation;
        Disposable d = Mono.delay(delay, timer)
                .flatMap(tick -> beginAttempt(gen)
                        ? connector.connect(cause -> onConnectionLost(gen, cause))
                        : Mono.<StreamChannel>empty())
                .subscribe(
                        ch -> onConnected(gen, ch),
                        err -> onConnectFailed(gen, err));
        // A synchronous failure may already have scheduled a newer attempt.
        if (gen == generation) {
            pendingAttempt = d;
        }
    }

    private synchronized boolean beginAttempt(long gen) {
        if (closed || gen != generation) {
            return false;
        }
        totalAttempts++;
        return true;
    }

    private synchronized void onConnected(long gen, StreamChannel ch) {
        if (closed || gen != generation) {
            closeQuietly(ch);
            return;
        }
        if (lostBeforeReady == gen) {
            closeQuietly(ch);
            onConnectFailed(gen, new IllegalStateException("connection closed before it became ready"));
            return;
        }
        channel = ch;
        consecutiveFailures = 0;
        lastError = null;
        state = ConnectionState.CONNECTED;
        pendingAttempt = null;
        outageReported = false;
        log.info("Search sync: stream connection established endpoint={} attempts={}", endpointLabel, totalAttempts);
    }

    private synchronized void onConnectFailed(long gen, Throwable err) {
        if (closed || gen != generation || state != ConnectionState.CONNECTING) {
            return;
        }
        int failures = ++consecutiveFailures;
        lastError = describe(err);

        if (policy.isExhausted(failures)) {
            state = ConnectionState.DISABLED;
            pendingAttempt = null;
            log.warn("Search sync: stream connection failed after {} retries, publishing disabled until restart. endpoint={} err={}",
                    policy.maxRetries(), endpointLabel, lastError);
            return;
        }

        Duration delay = policy.delayAfter(failures);
        if (!outageReported) {
            outageReported = true;
            log.warn("Search sync: could not connect to stream store, retrying. endpoint={} err={}", endpointLabel, lastError);
        } else {
            log.debug("Search sync: connect attempt failed failures={} nextDelay={} err={}", failures, delay, lastError);
        }
        scheduleAttempt(delay);
    }

    private void onConnectionLost(long gen, Throwable cause) {
        StreamChannel old;
        synchronized (this) {
            if (closed || gen != generation) {
                return;
            }
            if (state != ConnectionState.CONNECTED) {
                // Lost between the client handing us the connection and onConnected running.
                lostBeforeReady = gen;
                return;
            }
            state = ConnectionState.DISCONNECTED;
            old = channel;
            channel = null;
            lastError = cause == null ? "connection closed" : describe(cause);
            log.error("Search sync: stream connection lost, reconnecting. endpoint={} err={}", endpointLabel, lastError);
            outageReported = true;

            state = ConnectionState.CONNECTING;
            scheduleAttempt(Duration.ZERO);
        }
        closeQuietly(old);
    }

    /**
     * Cancels any pending attempt and closes the live channel. The manager cannot be restarted.
     */
    @Override
    public void close() {
        StreamChannel old;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            generation++;
            if (pendingAttempt != null && !pendingAttempt.isDisposed()) {
                pendingAttempt.dispose();
            }
            pendingAttempt = null;
            old = channel;
            channel = null;
            if (state != ConnectionState.DISABLED) {
                state = ConnectionState.DISCONNECTED;
            }
        }
        // Outside the lock: client shutdown may wait on I/O threads that call back into this manager.
        closeQuietly(old);
        try {
            connector.shutdown();
        } catch (RuntimeException e) {
            log.debug("Connector shutdown failed (ignored): {}", e.toString());
        }
    }

    private static void closeQuietly(StreamChannel ch) {
        if (ch == null) {
            return;
        }
        try {
            ch.close();
        } catch (RuntimeException e) {
            log.debug("Channel close failed (ignored): {}", e.toString());
        }
    }

    private static String describe(Throwable err) {
        if (err == null) {
            return null;
        }
        String msg = err.getMessage();
        return msg == null || msg.isBlank() ? err.getClass().getSimpleName() : msg;
    }
}
