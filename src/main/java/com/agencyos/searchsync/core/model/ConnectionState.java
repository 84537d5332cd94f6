package com.agencyos.searchsync.core.model;

/**
 * =====================================================================
 * ConnectionState
 * =====================================================================
 *
 * Lifecycle of the single connection to the streaming store, owned by
 * {@code ConnectionManager}.
 *
 * STATE MACHINE
 * -------------
 *
 *   DISCONNECTED ──start()──▶ CONNECTING ──success──▶ CONNECTED
 *        ▲                    │  ▲    │                   │
 *        │                    │  └────┘ failure,          │
 *        │                    │         retries left      │
 *        │                    │         (after backoff)   │
 *        └────────────────────┼──── transport error ◀─────┘
 *                             │     (then CONNECTING at once)
 *                             │
 *                             └──failure, retries spent──▶ DISABLED
 *
 * DISABLED is terminal until the process restarts.
 * Appends are attempted only while CONNECTED.
 */
public enum ConnectionState {

    /** No live connection and no attempt in progress. */
    DISCONNECTED,

    /** An attempt is running or a backoff timer is pending. */
    CONNECTING,

    /** A live connection exists; appends are allowed. */
    CONNECTED,

    /** Retries exhausted. Nothing will be published until restart. */
    DISABLED
}
