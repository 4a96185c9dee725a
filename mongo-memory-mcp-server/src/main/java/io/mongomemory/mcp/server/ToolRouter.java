package io.mongomemory.mcp.server;

import io.mongomemory.mcp.server.model.ToolCallResponse;
import io.mongomemory.mcp.server.model.ToolDefinition;
import io.mongomemory.mcp.server.provider.ToolProvider;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ToolRouter {
    private final Map<String, ToolProvider> providerByTool;
    private final Map<String, ToolDefinition> definitionByTool;

    public ToolRouter(List<? extends ToolProvider> providers) {
        this.providerByTool = new LinkedHashMap<>();
        this.definitionByTool = new LinkedHashMap<>();
        for (ToolProvider provider : providers) {
            for (ToolDefinition definition : provider.tools()) {
                if (providerByTool.containsKey(definition.name())) {
                    throw new IllegalArgumentException("Tool " + definition.name() + " is registered twice");
                }
                providerByTool.put(definition.name(), provider);
                definitionByTool.put(definition.name(), definition);
            }
        }
    }

    public List<ToolDefinition> listTools() {
        List<ToolDefinition> all = new ArrayList<>(definitionByTool.values());
        all.sort(Comparator.comparing(ToolDefinition::name));
        return all;
    }

    public ToolCallResponse callTool(String toolName, Map<String, Object> arguments) {
        ToolProvider provider = providerByTool.get(toolName);
        if (provider == null) {
            return ToolCallResponse.error("Unknown tool: " + toolName);
        }
        return provider.execute(toolName, arguments == null ? Map.of() : arguments);
    }
}
