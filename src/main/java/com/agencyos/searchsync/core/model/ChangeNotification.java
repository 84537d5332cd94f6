package com.agencyos.searchsync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * =====================================================================
 * ChangeNotification
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Describes one committed data mutation in the host CMS, as handed to the
 * publisher by the host's lifecycle dispatch.
 *
 * LIFECYCLE
 * ---------
 * 1. Host commits a create / update / delete on a collection
 * 2. Host fires the matching lifecycle hook
 * 3. Hook builds a ChangeNotification and calls the publisher
 * 4. Notification is discarded once handled
 *
 * Notifications are never persisted. If the process dies while one is being
 * handled, its entries may be lost.
 *
 * ORDERING
 * --------
 * {@link #recordIds()} is ordered; entries are appended in exactly this order.
 */
public record ChangeNotification(

        /** upsert for create/update, delete for delete. */
        ChangeAction action,

        /** Host collection (table) name, e.g. {@code pntl_products}. */
        String sourceName,

        /** Affected primary keys, stringified by the host hook. Never null, may be empty. */
        List<String> recordIds) {

    public ChangeNotification {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(sourceName, "sourceName");
        recordIds = recordIds == null ? List.of() : List.copyOf(recordIds);
    }

    public static ChangeNotification upsert(String sourceName, List<String> recordIds) {
        return new ChangeNotification(ChangeAction.UPSERT, sourceName, recordIds);
    }

    public static ChangeNotification delete(String sourceName, List<String> recordIds) {
        return new ChangeNotification(ChangeAction.DELETE, sourceName, recordIds);
    }
}
