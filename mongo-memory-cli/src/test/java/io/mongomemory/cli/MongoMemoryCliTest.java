package io.mongomemory.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MongoMemoryCliTest {

    private MockWebServer server;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() throws IOException {
        System.setOut(originalOut);
        System.setErr(originalErr);
        server.shutdown();
    }

    @Test
    void toolsPrintsOneLinePerTool() {
        server.enqueue(new MockResponse().setBody("""
            {"tools": [
              {"name": "create_entities", "description": "Create entities in memory. Each entity needs a name.", "mutating": true},
              {"name": "get_entity", "description": "Get a single entity by its name.", "mutating": false}
            ], "instructions": "Call get_usage_guide first."}
            """));

        int code = execute("tools");

        assertThat(code).isZero();
        assertThat(stdout()).contains(
            "create_entities [mutating] - Create entities in memory.",
            "get_entity - Get a single entity by its name."
        );
    }

    @Test
    void callSendsArgumentsAndExitsWithToolOutcome() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ok\":true,\"message\":\"Executed get_entity\",\"data\":{\"success\":true}}"));
        server.enqueue(new MockResponse().setResponseCode(400)
            .setBody("{\"ok\":false,\"message\":\"Not found: Entity 'x' not found\",\"data\":{\"success\":false}}"));

        int found = execute("call", "get_entity", "--args", "{\"name\":\"ada\"}");
        int missing = execute("call", "get_entity", "-a", "{\"name\":\"x\"}");

        assertThat(found).isZero();
        assertThat(missing).isEqualTo(1);
        assertThat(stdout()).contains("\"Executed get_entity\"").contains("Not found").doesNotContain("http_status");
        RecordedRequest first = server.takeRequest();
        assertThat(first.getBody().readUtf8()).contains("\"arguments\":{\"name\":\"ada\"}");
    }

    @Test
    void callRejectsArgumentsThatAreNotJson() {
        int code = execute("call", "get_entity", "--args", "name=ada");

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("--args must be a JSON object");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void healthReportsTheServerState() {
        server.enqueue(new MockResponse().setBody("{\"status\":\"ok\"}"));
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\":\"boom\"}"));

        assertThat(execute("health")).isZero();
        assertThat(execute("health")).isEqualTo(1);
        assertThat(stdout()).contains("is healthy");
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("HTTP 500");
    }

    @Test
    void serverOptionOverridesTheDefault() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"status\":\"ok\"}"));
        CliContext unreachableDefault = new CliContext("http://127.0.0.1:1");

        int code = MongoMemoryCli.commandLine(unreachableDefault)
            .execute("--server", server.url("/").toString(), "health");

        assertThat(code).isZero();
        assertThat(server.takeRequest().getPath()).isEqualTo("/healthz");
    }

    private int execute(String... args) {
        return MongoMemoryCli.commandLine(new CliContext(server.url("/").toString())).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }
}
