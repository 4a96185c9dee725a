package io.mongomemory.mcp.server.provider;

public final class InvalidArgumentException extends IllegalArgumentException {
    private final String argument;

    public InvalidArgumentException(String argument, String message) {
        super(message);
        this.argument = argument;
    }

    public String argument() {
        return argument;
    }
}
