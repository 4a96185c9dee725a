package io.mongomemory.core.db;

import io.mongomemory.core.config.MemoryStoreConfig;

@FunctionalInterface
public interface DatabaseConnector {
    MemoryDatabase connect(MemoryStoreConfig config) throws DatabaseException;
}
