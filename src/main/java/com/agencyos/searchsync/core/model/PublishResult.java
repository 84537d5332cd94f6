package com.agencyos.searchsync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Structured result of handling one {@link ChangeNotification}.
 *
 * <p>The publisher never throws to its caller; this value is how a caller (or a test) learns what
 * actually happened.</p>
 *
 * @param status   outcome category
 * @param entryIds store-assigned ids of the appended entries, in append order
 * @param failed   number of entries dropped after an append failure
 */
public record PublishResult(PublishStatus status, List<String> entryIds, int failed) {

    public PublishResult {
        Objects.requireNonNull(status, "status");
        entryIds = entryIds == null ? List.of() : List.copyOf(entryIds);
    }

    public static PublishResult skipped(PublishStatus status) {
        if (!status.isSkipped()) {
            throw new IllegalArgumentException("Not a skip status: " + status);
        }
        return new PublishResult(status, List.of(), 0);
    }

    /**
     * Derives the status from the append counts of an attempted batch.
     */
    public static PublishResult attempted(List<String> entryIds, int failed) {
        PublishStatus status;
        if (failed == 0) {
            status = PublishStatus.PUBLISHED;
        } else if (entryIds.isEmpty()) {
            status = PublishStatus.FAILED;
        } else {
            status = PublishStatus.PARTIALLY_PUBLISHED;
        }
        return new PublishResult(status, entryIds, failed);
    }

    public int appended() {
        return entryIds.size();
    }
}
