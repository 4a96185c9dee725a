package io.mongomemory.core.envelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record StoreResult(
    boolean success,
    ErrorKind kind,
    String message,
    String details,
    Map<String, Object> fields
) {
    public StoreResult {
        if (success && kind != null) {
            throw new IllegalArgumentException("a successful result must not carry an error kind");
        }
        if (!success) {
            Objects.requireNonNull(kind, "kind must not be null for an error result");
        }
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static StoreResult ok(Map<String, Object> fields) {
        return new StoreResult(true, null, null, null, fields);
    }

    public static StoreResult error(ErrorKind kind, String message) {
        return error(kind, message, null, Map.of());
    }

    public static StoreResult error(ErrorKind kind, String message, String details) {
        return error(kind, message, details, Map.of());
    }

    public static StoreResult error(ErrorKind kind, String message, String details, Map<String, Object> fields) {
        return new StoreResult(false, kind, message, details, fields);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", success);
        if (!success) {
            out.put("error", kind.label());
            out.put("message", message);
            if (details != null) {
                out.put("details", details);
            }
        }
        fields.forEach(out::putIfAbsent);
        return out;
    }
}
