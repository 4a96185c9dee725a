package io.mongomemory.mcp.server.provider;

import io.mongomemory.core.envelope.StoreResult;
import io.mongomemory.core.structure.MemoryStructureService;
import java.util.List;
import java.util.Map;

public final class GuideToolProvider extends AbstractToolProvider {

    public GuideToolProvider(MemoryStructureService structure, String usageGuide) {
        super(
            List.of(
                new ToolOperation(
                    "get_memory_structure",
                    "Get the current memory structure: the configured layout if one exists, otherwise the fields"
                        + " and values found in stored entities.",
                    objectSchema(Map.of(), List.of()),
                    false,
                    args -> structure.getMemoryStructure()
                ),
                new ToolOperation(
                    "get_usage_guide",
                    "Recommended first step: get a quick start guide with examples for this memory service."
                        + " Skip it when the guide was already retrieved in this conversation.",
                    objectSchema(Map.of(), List.of()),
                    false,
                    args -> StoreResult.ok(Map.of("guide", usageGuide))
                )
            )
        );
    }

    @Override
    public String name() {
        return "guide";
    }
}
