package io.mongomemory.core.config;

import io.mongomemory.core.entity.OrphanPolicy;
import java.time.Duration;

public record MemoryStoreConfig(
    String connectionString,
    String database,
    String entityCollection,
    String relationshipCollection,
    String systemDatabase,
    String systemCollection,
    Duration serverSelectionTimeout,
    OrphanPolicy orphanPolicy,
    int structureSampleSize
) {
    public static final String CONNECTION_ENV = "MCP_MONGO_MEMORY_CONNECTION";

    public static MemoryStoreConfig fromEnv() {
        return new MemoryStoreConfig(
            env(CONNECTION_ENV, ""),
            env("MONGO_MEMORY_DATABASE", "agent_memory"),
            "entities",
            "relationships",
            env("MONGO_MEMORY_SYSTEM_DATABASE", "memory"),
            "sys",
            Duration.ofSeconds(intEnv("MONGO_MEMORY_SERVER_SELECTION_TIMEOUT_SECONDS", 5)),
            OrphanPolicy.parse(System.getenv("MONGO_MEMORY_ORPHAN_POLICY"), OrphanPolicy.KEEP),
            intEnv("MONGO_MEMORY_STRUCTURE_SAMPLE_SIZE", 1_000)
        );
    }

    public static MemoryStoreConfig defaults(String connectionString) {
        return new MemoryStoreConfig(
            connectionString,
            "agent_memory",
            "entities",
            "relationships",
            "memory",
            "sys",
            Duration.ofSeconds(5),
            OrphanPolicy.KEEP,
            1_000
        );
    }

    public boolean configured() {
        return connectionString != null && !connectionString.isBlank();
    }

    public MemoryStoreConfig withOrphanPolicy(OrphanPolicy policy) {
        return new MemoryStoreConfig(
            connectionString,
            database,
            entityCollection,
            relationshipCollection,
            systemDatabase,
            systemCollection,
            serverSelectionTimeout,
            policy,
            structureSampleSize
        );
    }

    private static String env(String key, String fallback) {
        String value = System.getenv(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int intEnv(String key, int fallback) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
