package com.agencyos.searchsync.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One record appended to the search sync stream.
 *
 * <h2>Wire format</h2>
 * Entries are written as flat key/value pairs. Field order is stable but consumers must not rely on it:
 * <pre>
 * action       upsert | delete
 * tenant       tenant slug derived from the collection name
 * entity_type  entity kind derived from the collection name, or "unknown"
 * entity_id    record identifier
 * collection   original collection name
 * timestamp    epoch milliseconds, decimal string
 * </pre>
 *
 * <p>The entry id is not part of this record: it is assigned by the streaming store on append.</p>
 */
public record StreamEntry(
        ChangeAction action,
        String tenant,
        String entityKind,
        String recordId,
        String sourceName,
        long timestampMillis) {

    public static final String FIELD_ACTION = "action";
    public static final String FIELD_TENANT = "tenant";
    public static final String FIELD_ENTITY_TYPE = "entity_type";
    public static final String FIELD_ENTITY_ID = "entity_id";
    public static final String FIELD_COLLECTION = "collection";
    public static final String FIELD_TIMESTAMP = "timestamp";

    public StreamEntry {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(tenant, "tenant");
        Objects.requireNonNull(entityKind, "entityKind");
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(sourceName, "sourceName");
    }

    /**
     * Builds the entry for one record of a classified notification.
     */
    public static StreamEntry of(ChangeNotification notification, ClassificationResult classification,
                                 String recordId, long timestampMillis) {
        return new StreamEntry(
                notification.action(),
                classification.tenant(),
                classification.entityKind(),
                recordId,
                notification.sourceName(),
                timestampMillis);
    }

    /**
     * @return the wire fields in their canonical order
     */
    public Map<String, String> toFields() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put(FIELD_ACTION, action.wireValue());
        out.put(FIELD_TENANT, tenant);
        out.put(FIELD_ENTITY_TYPE, entityKind);
        out.put(FIELD_ENTITY_ID, recordId);
        out.put(FIELD_COLLECTION, sourceName);
        out.put(FIELD_TIMESTAMP, Long.toString(timestampMillis));
        return out;
    }
}
