package io.mongomemory.mcp.server.provider;

import java.util.Map;

public record ToolOperation(
    String toolName,
    String description,
    Map<String, Object> inputSchema,
    boolean mutating,
    ToolHandler handler
) {
}
