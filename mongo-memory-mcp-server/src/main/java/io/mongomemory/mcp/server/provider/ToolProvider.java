package io.mongomemory.mcp.server.provider;

import io.mongomemory.mcp.server.model.ToolCallResponse;
import io.mongomemory.mcp.server.model.ToolDefinition;
import java.util.List;
import java.util.Map;

public interface ToolProvider {
    String name();

    List<ToolDefinition> tools();

    ToolCallResponse execute(String toolName, Map<String, Object> arguments);

    default boolean supports(String toolName) {
        return tools().stream().anyMatch(tool -> tool.name().equals(toolName));
    }
}
