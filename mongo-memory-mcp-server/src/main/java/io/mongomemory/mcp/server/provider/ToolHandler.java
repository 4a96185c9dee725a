package io.mongomemory.mcp.server.provider;

import io.mongomemory.core.envelope.StoreResult;

@FunctionalInterface
public interface ToolHandler {
    StoreResult handle(ToolArguments arguments);
}
