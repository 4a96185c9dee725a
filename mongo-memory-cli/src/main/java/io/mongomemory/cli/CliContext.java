package io.mongomemory.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Function;

public record CliContext(
    String defaultServerUrl,
    Function<String, McpToolClient> clients,
    ObjectMapper mapper
) {
    public static final String SERVER_URL_ENV = "MONGO_MEMORY_SERVER_URL";

    public CliContext(String defaultServerUrl) {
        this(defaultServerUrl, McpToolClient::new, new ObjectMapper());
    }

    public static CliContext fromEnv() {
        String value = System.getenv(SERVER_URL_ENV);
        return new CliContext(value == null || value.isBlank() ? McpToolClient.DEFAULT_BASE_URL : value.trim());
    }

    public McpToolClient client(String serverOverride) {
        String url = serverOverride == null || serverOverride.isBlank() ? defaultServerUrl : serverOverride;
        return clients.apply(url);
    }
}
