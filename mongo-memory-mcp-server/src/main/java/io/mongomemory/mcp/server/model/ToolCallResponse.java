package io.mongomemory.mcp.server.model;

import io.mongomemory.core.envelope.StoreResult;
import java.util.Map;

public record ToolCallResponse(
    boolean ok,
    String message,
    Map<String, Object> data
) {
    public static ToolCallResponse ok(String message, Map<String, Object> data) {
        return new ToolCallResponse(true, message, data == null ? Map.of() : data);
    }

    public static ToolCallResponse error(String message) {
        return new ToolCallResponse(false, message, Map.of());
    }

    public static ToolCallResponse of(String toolName, StoreResult result) {
        if (result.success()) {
            return ok("Executed " + toolName, result.toMap());
        }
        return new ToolCallResponse(false, result.kind().label() + ": " + result.message(), result.toMap());
    }
}
