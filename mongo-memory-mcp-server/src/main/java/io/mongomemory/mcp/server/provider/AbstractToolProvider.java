package io.mongomemory.mcp.server.provider;

import io.mongomemory.core.envelope.ErrorKind;
import io.mongomemory.core.envelope.StoreResult;
import io.mongomemory.mcp.server.model.ToolCallResponse;
import io.mongomemory.mcp.server.model.ToolDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AbstractToolProvider implements ToolProvider {
    private static final Logger log = LoggerFactory.getLogger(AbstractToolProvider.class);

    static final String FIRST_CALL_HINT = " If this is your first memory operation in this session, call get_usage_guide first.";

    private final Map<String, ToolOperation> operations;

    protected AbstractToolProvider(List<ToolOperation> operations) {
        this.operations = new LinkedHashMap<>();
        for (ToolOperation operation : operations) {
            this.operations.put(operation.toolName(), operation);
        }
    }

    @Override
    public List<ToolDefinition> tools() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolOperation operation : operations.values()) {
            definitions.add(
                new ToolDefinition(
                    operation.toolName(),
                    operation.description(),
                    operation.inputSchema(),
                    name(),
                    operation.mutating()
                )
            );
        }
        return definitions;
    }

    @Override
    public ToolCallResponse execute(String toolName, Map<String, Object> arguments) {
        ToolOperation operation = operations.get(toolName);
        if (operation == null) {
            return ToolCallResponse.error("Unknown tool: " + toolName);
        }
        StoreResult result;
        try {
            result = operation.handler().handle(new ToolArguments(arguments));
        } catch (InvalidArgumentException e) {
            log.debug("Rejected arguments for {}: {}", toolName, e.getMessage());
            result = StoreResult.error(ErrorKind.VALIDATION, e.getMessage(), "Check the input schema of " + toolName);
        }
        return ToolCallResponse.of(toolName, result);
    }

    protected static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        schema.put("additionalProperties", false);
        return schema;
    }

    protected static Map<String, Object> properties(Object... namesAndSchemas) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < namesAndSchemas.length; i += 2) {
            out.put((String) namesAndSchemas[i], namesAndSchemas[i + 1]);
        }
        return out;
    }

    protected static Map<String, Object> property(String type, String description) {
        return Map.of("type", type, "description", description);
    }
}
