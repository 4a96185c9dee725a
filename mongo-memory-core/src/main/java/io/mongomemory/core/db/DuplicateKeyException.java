package io.mongomemory.core.db;

public final class DuplicateKeyException extends DatabaseException {
    private final int insertedCount;
    private final int failedIndex;

    public DuplicateKeyException(String message, int insertedCount, int failedIndex, Throwable cause) {
        super(message, cause);
        this.insertedCount = insertedCount;
        this.failedIndex = failedIndex;
    }

    public DuplicateKeyException(String message) {
        this(message, 0, 0, null);
    }

    public int insertedCount() {
        return insertedCount;
    }

    public int failedIndex() {
        return failedIndex;
    }
}
