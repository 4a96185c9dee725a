package io.mongomemory.mcp.server.provider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ToolArguments {
    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    public String requireString(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw missing(name);
        }
        if (!(value instanceof String text)) {
            throw wrongType(name, "a string", value);
        }
        return text;
    }

    public int optionalInt(String name, int fallback) {
        Object value = values.get(name);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long number = ((Number) value).longValue();
            if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
                throw outOfRange(name);
            }
            return (int) number;
        }
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            double integral = number.doubleValue();
            if (integral < Integer.MIN_VALUE || integral > Integer.MAX_VALUE) {
                throw outOfRange(name);
            }
            return (int) integral;
        }
        throw wrongType(name, "an integer", value);
    }

    public boolean optionalBoolean(String name, boolean fallback) {
        Object value = values.get(name);
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof Boolean flag)) {
            throw wrongType(name, "a boolean", value);
        }
        return flag;
    }

    public Map<String, Object> requireObject(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw missing(name);
        }
        return asObject(name, value);
    }

    public Map<String, Object> optionalObject(String name) {
        Object value = values.get(name);
        return value == null ? null : asObject(name, value);
    }

    public Map<String, String> optionalStringMap(String name) {
        Map<String, Object> raw = optionalObject(name);
        if (raw == null) {
            return null;
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> || value instanceof List<?>) {
                throw wrongType(name + "." + entry.getKey(), "a scalar", value);
            }
            out.put(entry.getKey(), value == null ? "" : String.valueOf(value));
        }
        return out;
    }

    // null items are kept so the store can report their index
    public List<Map<String, Object>> requireObjectList(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw missing(name);
        }
        if (!(value instanceof List<?> items)) {
            throw wrongType(name, "an array of objects", value);
        }
        List<Map<String, Object>> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            out.add(item == null ? null : asObject(name + "[" + i + "]", item));
        }
        return out;
    }

    private static Map<String, Object> asObject(String name, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw wrongType(name, "an object", value);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((key, item) -> out.put(String.valueOf(key), item));
        return out;
    }

    private static InvalidArgumentException missing(String name) {
        return new InvalidArgumentException(name, "Missing required argument: " + name);
    }

    private static InvalidArgumentException outOfRange(String name) {
        return new InvalidArgumentException(name, "Argument '" + name + "' is out of range");
    }

    private static InvalidArgumentException wrongType(String name, String expected, Object actual) {
        return new InvalidArgumentException(
            name,
            "Argument '" + name + "' must be " + expected + " but was " + describe(actual)
        );
    }

    private static String describe(Object value) {
        if (value instanceof String) {
            return "a string";
        }
        if (value instanceof Number) {
            return "a number";
        }
        if (value instanceof Boolean) {
            return "a boolean";
        }
        if (value instanceof List<?>) {
            return "an array";
        }
        if (value instanceof Map<?, ?>) {
            return "an object";
        }
        return value.getClass().getSimpleName();
    }
}
