package com.agencyos.searchsync.core.model;

/**
 * Outcome of classifying a collection name.
 *
 * @param relevant   whether changes to the collection are published at all
 * @param tenant     collection name with the matched suffix removed (the whole name when not relevant)
 * @param entityKind matched suffix without its separator, or {@link #UNKNOWN_ENTITY_KIND}
 */
public record ClassificationResult(boolean relevant, String tenant, String entityKind) {

    public static final String UNKNOWN_ENTITY_KIND = "unknown";

    public static ClassificationResult notRelevant(String sourceName) {
        return new ClassificationResult(false, sourceName, UNKNOWN_ENTITY_KIND);
    }
}
