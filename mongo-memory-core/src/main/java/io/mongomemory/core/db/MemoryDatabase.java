package io.mongomemory.core.db;

public interface MemoryDatabase extends AutoCloseable {
    void ping() throws DatabaseException;

    DocumentCollection collection(String database, String collection);

    @Override
    void close();
}
