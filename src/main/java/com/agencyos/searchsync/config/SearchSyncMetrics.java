package com.agencyos.searchsync.config;

import com.agencyos.searchsync.core.connection.ConnectionManager;
import com.agencyos.searchsync.core.model.ConnectionState;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Micrometer view of the connection manager.
 *
 * <ul>
 *   <li>{@code searchsync.connection.available}: 1 while connected, else 0</li>
 *   <li>{@code searchsync.connection.disabled}: 1 once retries are exhausted</li>
 *   <li>{@code searchsync.connection.failures}: consecutive connect failures</li>
 *   <li>{@code searchsync.connection.attempts}: connect attempts since start</li>
 * </ul>
 *
 * Publish counters are registered by the publisher itself.
 */
public class SearchSyncMetrics implements MeterBinder {

    private final ConnectionManager connection;

    public SearchSyncMetrics(ConnectionManager connection) {
        this.connection = connection;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("searchsync.connection.available", connection, c -> c.isAvailable() ? 1 : 0)
                .description("1 while the stream connection is established")
                .register(registry);
        Gauge.builder("searchsync.connection.disabled", connection,
                        c -> c.state() == ConnectionState.DISABLED ? 1 : 0)
                .description("1 once reconnect retries are exhausted")
                .register(registry);
        Gauge.builder("searchsync.connection.failures", connection, c -> c.snapshot().consecutiveFailures())
                .description("Consecutive connect failures")
                .register(registry);
        FunctionCounter.builder("searchsync.connection.attempts", connection, c -> c.snapshot().totalAttempts())
                .description("Connect attempts since start")
                .register(registry);
    }
}
