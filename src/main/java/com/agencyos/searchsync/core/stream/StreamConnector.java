package com.agencyos.searchsync.core.stream;

import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * =====================================================================
 * StreamConnector
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Transport-facing contract for opening a connection to the streaming
 * store. Implementations exist for Redis streams and NATS JetStream; tests
 * use in-memory fakes.
 *
 * ROLE IN ARCHITECTURE
 * --------------------
 *
 *   [ ConnectionManager ]   owns state, retries, backoff
 *          │ connect()
 *          ▼
 *   [ StreamConnector ]     ← YOU ARE HERE
 *          │
 *          ▼
 *   [ Redis / JetStream client ]
 *
 * A connector deliberately knows NOTHING about retry policy. Client-library
 * auto-reconnect MUST be disabled so the manager is the single owner of
 * reconnection.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - Mono emits a channel      → the connection is live
 * - Mono errors               → this attempt failed; the manager decides what next
 * - onConnectionLost invoked  → a previously emitted channel is gone
 *
 * onConnectionLost MUST be invoked at most once per channel, and never for
 * a failed attempt.
 */
public interface StreamConnector {

    /**
     * Opens one connection.
     *
     * <p>Must not block the caller: blocking client calls belong on a Reactor worker scheduler.</p>
     *
     * @param onConnectionLost invoked when the returned channel's transport fails or closes
     *                         unexpectedly; receives the cause when one is known, else null
     * @return a Mono emitting the live channel
     */
    Mono<StreamChannel> connect(Consumer<Throwable> onConnectionLost);

    /**
     * Releases resources shared across connections (event loops, thread pools).
     */
    default void shutdown() {
    }
}
