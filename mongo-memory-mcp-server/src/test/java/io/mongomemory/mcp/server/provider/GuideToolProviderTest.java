package io.mongomemory.mcp.server.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.mongomemory.core.MongoMemory;
import io.mongomemory.core.config.MemoryStoreConfig;
import io.mongomemory.mcp.server.model.ToolCallResponse;
import java.time.Clock;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GuideToolProviderTest {

    @Test
    void servesTheGuideEvenWithoutADatabase() {
        try (MongoMemory memory = MongoMemory.open(MemoryStoreConfig.defaults(""), config -> {
            throw new AssertionError("must not connect");
        }, Clock.systemUTC())) {
            GuideToolProvider provider = new GuideToolProvider(memory.structure(), "# Guide");

            ToolCallResponse guide = provider.execute("get_usage_guide", Map.of());
            ToolCallResponse structure = provider.execute("get_memory_structure", Map.of());

            assertThat(guide.ok()).isTrue();
            assertThat(guide.data()).containsEntry("guide", "# Guide");
            assertThat(structure.ok()).isFalse();
            assertThat(structure.data())
                .containsEntry("error", "Configuration error")
                .containsEntry("message", "No MCP_MONGO_MEMORY_CONNECTION set for MongoDB");
        }
    }
}
