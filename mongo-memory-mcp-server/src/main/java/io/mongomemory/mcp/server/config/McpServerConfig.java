package io.mongomemory.mcp.server.config;

import io.mongomemory.core.config.MemoryStoreConfig;

public record McpServerConfig(
    int port,
    String host,
    MemoryStoreConfig memory
) {
    public static final int DEFAULT_PORT = 8791;

    public static McpServerConfig fromEnv() {
        return new McpServerConfig(
            intEnv("MONGO_MEMORY_PORT", DEFAULT_PORT),
            env("MONGO_MEMORY_HOST", "0.0.0.0"),
            MemoryStoreConfig.fromEnv()
        );
    }

    private static String env(String key, String fallback) {
        String value = System.getenv(key);
        return value == null || value.isBlank() ? fallback : value;
    }

    private static int intEnv(String key, int fallback) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
