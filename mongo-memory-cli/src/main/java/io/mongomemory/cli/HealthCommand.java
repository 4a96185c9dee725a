package io.mongomemory.cli;

import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(name = "health", description = "Check that the server is up")
public final class HealthCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    MongoMemoryCliCommand parent;

    public HealthCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        McpToolClient client = context.client(parent == null ? null : parent.server());
        try {
            Map<String, Object> response = client.health();
            if (Boolean.TRUE.equals(response.get("http_ok")) && "ok".equals(response.get("status"))) {
                System.out.println("Server " + client.baseUrl() + " is healthy");
                return 0;
            }
            System.err.println("Server " + client.baseUrl() + " answered HTTP " + response.get("http_status"));
            return 1;
        } catch (Exception e) {
            System.err.println("Health check failed for " + client.baseUrl() + ": " + e.getMessage());
            return 1;
        }
    }
}
