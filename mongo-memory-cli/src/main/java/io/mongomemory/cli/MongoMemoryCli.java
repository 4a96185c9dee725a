package io.mongomemory.cli;

import picocli.CommandLine;

public final class MongoMemoryCli {

    private MongoMemoryCli() {
    }

    public static void main(String[] args) {
        System.exit(commandLine(CliContext.fromEnv()).execute(args));
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new MongoMemoryCliCommand());
        commandLine.addSubcommand("tools", new ToolsCommand(context));
        commandLine.addSubcommand("call", new CallCommand(context));
        commandLine.addSubcommand("health", new HealthCommand(context));
        return commandLine;
    }
}
