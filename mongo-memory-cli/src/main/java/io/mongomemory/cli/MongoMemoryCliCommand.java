package io.mongomemory.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "mongo-memory", mixinStandardHelpOptions = true, description = "Operate a Mongo Memory tool server")
public final class MongoMemoryCliCommand implements Runnable {

    @Option(names = "--server", description = "Server base URL (default: $MONGO_MEMORY_SERVER_URL or http://127.0.0.1:8791)")
    String server;

    public String server() {
        return server;
    }

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
