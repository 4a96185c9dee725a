package io.mongomemory.core.config;

import io.mongomemory.core.envelope.ErrorKind;
import io.mongomemory.core.envelope.StoreResult;
import java.util.Objects;
import java.util.Optional;

public final class ConfigurationGate {
    private static final ConfigurationGate OPEN = new ConfigurationGate(null);

    private final StoreResult failure;

    private ConfigurationGate(StoreResult failure) {
        this.failure = failure;
    }

    public static ConfigurationGate open() {
        return OPEN;
    }

    public static ConfigurationGate closed(StoreResult failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        if (failure.success() || failure.kind() != ErrorKind.CONFIGURATION) {
            throw new IllegalArgumentException("a closed gate needs a configuration error");
        }
        return new ConfigurationGate(failure);
    }

    public boolean configured() {
        return failure == null;
    }

    public Optional<StoreResult> check() {
        return Optional.ofNullable(failure);
    }
}
