package com.agencyos.searchsync.core.model;

/**
 * Outcome category of a single {@code handle()} call.
 */
public enum PublishStatus {

    /** Every entry of the notification was appended. */
    PUBLISHED,

    /** Some entries were appended, some dropped after an append failure. */
    PARTIALLY_PUBLISHED,

    /** Every append failed; all entries were dropped. */
    FAILED,

    /** The notification carried no record ids. */
    SKIPPED_EMPTY,

    /** The collection does not match any configured suffix. */
    SKIPPED_NOT_RELEVANT,

    /** The connection was not in the connected state. */
    SKIPPED_UNAVAILABLE,

    /** No endpoint is configured; the publisher is inert for this process. */
    DISABLED;

    /**
     * @return true when no append was attempted
     */
    public boolean isSkipped() {
        return this == SKIPPED_EMPTY || this == SKIPPED_NOT_RELEVANT || this == SKIPPED_UNAVAILABLE || this == DISABLED;
    }
}
