package io.mongomemory.core.entity;

import java.util.Locale;

public enum OrphanPolicy {
    /** Leave the relationships in place as dangling references. */
    KEEP,
    /** Delete every relationship that starts or ends at the entity. */
    CASCADE,
    /** Refuse to delete an entity while any relationship references it. */
    REJECT;

    public static OrphanPolicy parse(String raw, OrphanPolicy fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
