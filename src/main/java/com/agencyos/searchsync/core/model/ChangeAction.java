package com.agencyos.searchsync.core.model;

import java.util.Locale;

/**
 * Kind of change carried by a {@link ChangeNotification}.
 *
 * <p>Creates and updates both collapse to {@link #UPSERT}: the downstream indexer only needs to
 * know whether a record should exist in the index or not.</p>
 */
public enum ChangeAction {

    /** Record was created or updated; the indexer should (re)load it. */
    UPSERT("upsert"),

    /** Record was removed; the indexer should drop it. */
    DELETE("delete");

    private final String wireValue;

    ChangeAction(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * @return the value written to the {@code action} field of a stream entry
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses the wire form ({@code upsert} / {@code delete}), case-insensitive.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static ChangeAction fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("action is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ChangeAction a : values()) {
            if (a.wireValue.equals(v)) {
                return a;
            }
        }
        throw new IllegalArgumentException("Unknown action: " + value + ". Valid values=[upsert, delete]");
    }
}
