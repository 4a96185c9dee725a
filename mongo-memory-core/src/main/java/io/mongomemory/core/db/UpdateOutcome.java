package io.mongomemory.core.db;

public record UpdateOutcome(long matchedCount, long modifiedCount, Object upsertedId) {
    public boolean upserted() {
        return upsertedId != null;
    }
}
