package io.mongomemory.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mongomemory.mcp.server.model.ToolCallResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpHttpServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(McpHttpServer.class);

    private final int requestedPort;
    private final String host;
    private final ToolRouter router;
    private final ObjectMapper mapper;
    private final String instructions;
    private Undertow undertow;
    private int actualPort;

    public McpHttpServer(int port, String host, ToolRouter router, ObjectMapper mapper, String instructions) {
        this.requestedPort = port;
        this.host = host;
        this.router = router;
        this.mapper = mapper;
        this.instructions = instructions;
        this.actualPort = port;
    }

    public synchronized void start() {
        if (undertow != null) {
            return;
        }
        undertow = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(this::route)
            .build();
        undertow.start();
        actualPort = resolveBoundPort(undertow, requestedPort);
        log.info("MCP server listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public synchronized void close() {
        if (undertow != null) {
            undertow.stop();
            undertow = null;
            log.info("MCP server stopped");
        }
    }

    private void route(HttpServerExchange exchange) throws Exception {
        String method = exchange.getRequestMethod().toString();
        String path = exchange.getRequestPath();

        if ("GET".equalsIgnoreCase(method) && "/healthz".equals(path)) {
            sendJson(exchange, 200, Map.of("status", "ok"));
            return;
        }

        if ("GET".equalsIgnoreCase(method) && "/mcp/tools".equals(path)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("tools", router.listTools());
            payload.put("instructions", instructions);
            sendJson(exchange, 200, payload);
            return;
        }

        if ("POST".equalsIgnoreCase(method) && "/mcp/call".equals(path)) {
            handleCall(exchange);
            return;
        }

        sendJson(exchange, 404, Map.of("error", "Not found"));
    }

    private void handleCall(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleCall(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        exchange.startBlocking();
        byte[] body = exchange.getInputStream().readAllBytes();
        Map<String, Object> request;
        try {
            request = body.length == 0 ? Map.of() : mapper.readValue(body, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            sendJson(exchange, 400, ToolCallResponse.error("Invalid JSON body: " + e.getOriginalMessage()));
            return;
        }

        Object rawName = request.get("name");
        if (!(rawName instanceof String name) || name.isBlank()) {
            sendJson(exchange, 400, ToolCallResponse.error("Missing tool name"));
            return;
        }
        Object rawArguments = request.get("arguments");
        if (rawArguments != null && !(rawArguments instanceof Map<?, ?>)) {
            sendJson(exchange, 400, ToolCallResponse.error("arguments must be a JSON object"));
            return;
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> arguments = rawArguments == null ? Map.of() : (Map<String, Object>) rawArguments;

        ToolCallResponse response = router.callTool(name, arguments);
        log.debug("Tool {} ok={}", name, response.ok());
        sendJson(exchange, response.ok() ? 200 : 400, response);
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        log.warn("Failed to handle {} {}", exchange.getRequestMethod(), exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, ToolCallResponse.error(error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            log.debug("Could not write error response", e);
            exchange.endExchange();
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        if (undertow.getListenerInfo().isEmpty()) {
            return fallbackPort;
        }
        Object address = undertow.getListenerInfo().get(0).getAddress();
        if (address instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
