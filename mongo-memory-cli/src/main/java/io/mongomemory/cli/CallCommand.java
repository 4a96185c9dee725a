package io.mongomemory.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "call", description = "Invoke a tool and print its JSON response")
public final class CallCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    MongoMemoryCliCommand parent;

    @Parameters(index = "0", arity = "1", description = "Tool name, e.g. get_entity")
    String tool;

    @Option(names = {"-a", "--args"}, description = "Tool arguments as a JSON object", defaultValue = "{}")
    String arguments;

    public CallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Map<String, Object> parsed;
        try {
            parsed = context.mapper().readValue(arguments, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            System.err.println("--args must be a JSON object: " + e.getOriginalMessage());
            return 1;
        }

        McpToolClient client = context.client(parent == null ? null : parent.server());
        try {
            Map<String, Object> response = client.callTool(tool, parsed);
            boolean ok = Boolean.TRUE.equals(response.get("ok"));
            response.remove("http_status");
            response.remove("http_ok");
            System.out.println(context.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(response));
            return ok ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Call command failed: " + e.getMessage());
            return 1;
        }
    }
}
