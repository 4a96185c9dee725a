package io.mongomemory.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpToolClient {
    private static final Logger log = LoggerFactory.getLogger(McpToolClient.class);
    private static final MediaType JSON = MediaType.get("application/json");

    public static final String DEFAULT_BASE_URL = "http://127.0.0.1:8791";

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public McpToolClient(String baseUrl) {
        this(baseUrl, new OkHttpClient.Builder().callTimeout(Duration.ofSeconds(30)).build(), new ObjectMapper());
    }

    public McpToolClient(String baseUrl, OkHttpClient client, ObjectMapper mapper) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.client = client;
        this.mapper = mapper;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public Map<String, Object> health() throws IOException {
        return execute(new Request.Builder().url(baseUrl + "/healthz").get().build());
    }

    public Map<String, Object> listTools() throws IOException {
        Request request = new Request.Builder()
            .url(baseUrl + "/mcp/tools")
            .get()
            .build();
        return execute(request);
    }

    public Map<String, Object> callTool(String toolName, Map<String, Object> arguments) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", toolName);
        payload.put("arguments", arguments == null ? Map.of() : arguments);

        Request request = new Request.Builder()
            .url(baseUrl + "/mcp/call")
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();

        return execute(request);
    }

    private static String normalizeBaseUrl(String value) {
        String raw = (value == null || value.isBlank()) ? DEFAULT_BASE_URL : value.trim();
        if (raw.endsWith("/")) {
            return raw.substring(0, raw.length() - 1);
        }
        return raw;
    }

    private Map<String, Object> execute(Request request) throws IOException {
        log.debug("{} {}", request.method(), request.url());
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            Map<String, Object> parsed = text.isBlank()
                ? new LinkedHashMap<>()
                : mapper.readValue(text, new TypeReference<LinkedHashMap<String, Object>>() {});
            parsed.put("http_status", response.code());
            parsed.put("http_ok", response.isSuccessful());
            return parsed;
        }
    }
}
