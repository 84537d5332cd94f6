package com.agencyos.searchsync.hook;

import java.util.List;
import java.util.Objects;

/**
 * Application event a host can publish instead of calling {@link ItemLifecycleHooks} directly.
 *
 * @param kind       which committed action happened
 * @param collection host collection name
 * @param keys       affected primary keys; stringified with {@link String#valueOf(Object)}
 */
public record ItemActionEvent(Kind kind, String collection, List<?> keys) {

    public enum Kind { CREATE, UPDATE, DELETE }

    public ItemActionEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(collection, "collection");
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public static ItemActionEvent created(String collection, Object key) {
        return new ItemActionEvent(Kind.CREATE, collection, key == null ? List.of() : List.of(key));
    }

    public static ItemActionEvent updated(String collection, List<?> keys) {
        return new ItemActionEvent(Kind.UPDATE, collection, keys);
    }

    public static ItemActionEvent deleted(String collection, List<?> keys) {
        return new ItemActionEvent(Kind.DELETE, collection, keys);
    }
}
