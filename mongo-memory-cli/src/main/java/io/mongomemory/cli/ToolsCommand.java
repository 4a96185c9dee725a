package io.mongomemory.cli;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "tools", description = "List the tools the server exposes")
public final class ToolsCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    MongoMemoryCliCommand parent;

    @Option(names = "--json", description = "Print the raw JSON listing")
    boolean json;

    public ToolsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        McpToolClient client = context.client(parent == null ? null : parent.server());
        try {
            Map<String, Object> response = client.listTools();
            if (!Boolean.TRUE.equals(response.get("http_ok"))) {
                System.err.println("Listing tools failed with HTTP " + response.get("http_status"));
                return 1;
            }
            if (json) {
                response.remove("http_status");
                response.remove("http_ok");
                System.out.println(context.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(response));
                return 0;
            }
            Object tools = response.get("tools");
            if (tools instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof Map<?, ?> tool) {
                        String marker = Boolean.TRUE.equals(tool.get("mutating")) ? " [mutating]" : "";
                        System.out.println(tool.get("name") + marker + " - " + firstSentence(tool.get("description")));
                    }
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Tools command failed: " + e.getMessage());
            return 1;
        }
    }

    static String firstSentence(Object description) {
        String text = description == null ? "" : String.valueOf(description).strip();
        int end = text.indexOf(". ");
        return end < 0 ? text : text.substring(0, end + 1);
    }
}
