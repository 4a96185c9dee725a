package io.mongomemory.mcp.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mongomemory.core.MongoMemory;
import io.mongomemory.mcp.server.config.McpServerConfig;
import io.mongomemory.mcp.server.provider.EntityToolProvider;
import io.mongomemory.mcp.server.provider.GuideToolProvider;
import io.mongomemory.mcp.server.provider.RelationshipToolProvider;
import io.mongomemory.mcp.server.provider.ToolProvider;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpServerApplication {
    private static final Logger log = LoggerFactory.getLogger(McpServerApplication.class);

    private McpServerApplication() {
    }

    public static void main(String[] args) {
        McpServerConfig config = McpServerConfig.fromEnv();
        MongoMemory memory = MongoMemory.open(config.memory());
        if (memory.gate().configured()) {
            log.info("Memory store ready (database {})", config.memory().database());
        } else {
            log.warn("Memory store unavailable; every tool call will report a configuration error");
        }

        McpHttpServer server = new McpHttpServer(
            config.port(),
            config.host(),
            router(memory),
            objectMapper(),
            ServerResources.instructions()
        );
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            memory.close();
        }));
    }

    static ToolRouter router(MongoMemory memory) {
        List<ToolProvider> providers = List.of(
            new EntityToolProvider(memory.entities()),
            new RelationshipToolProvider(memory.relationships()),
            new GuideToolProvider(memory.structure(), ServerResources.usageGuide())
        );
        return new ToolRouter(providers);
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
