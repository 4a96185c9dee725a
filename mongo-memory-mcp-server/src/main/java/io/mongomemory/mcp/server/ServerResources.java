package io.mongomemory.mcp.server;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class ServerResources {
    static final String USAGE_GUIDE = "usage-guide.md";
    static final String INSTRUCTIONS = "instructions.txt";

    private ServerResources() {
    }

    public static String usageGuide() {
        return load(USAGE_GUIDE);
    }

    public static String instructions() {
        return load(INSTRUCTIONS).strip();
    }

    static String load(String name) {
        try (InputStream in = ServerResources.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath resource " + name, e);
        }
    }
}
