package com.agencyos.searchsync.core.model;

/**
 * Point-in-time view of the connection manager, for status endpoints, metrics and tests.
 *
 * @param state               current state
 * @param consecutiveFailures failures since the last successful connect
 * @param totalAttempts       connect attempts since the process started
 * @param lastError           description of the most recent connect or transport failure, or null
 */
public record ConnectionSnapshot(ConnectionState state, int consecutiveFailures, long totalAttempts, String lastError) {
}
