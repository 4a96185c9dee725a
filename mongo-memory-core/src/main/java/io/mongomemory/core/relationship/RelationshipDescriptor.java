package io.mongomemory.core.relationship;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code type[:key=value(,key=value)*]}, split at the first {@code ':'} and at the first {@code '='} of each
 * property, with keys and values trimmed. A segment that is not a {@code key=value} pair is rejected.
 */
public record RelationshipDescriptor(String type, Map<String, String> properties) {
    public static final String EXPECTED_FORMAT = "type:key1=value1,key2=value2";

    public RelationshipDescriptor {
        Objects.requireNonNull(type, "type must not be null");
        if (type.isBlank()) {
            throw new DescriptorFormatException(type, "Relationship type must not be blank");
        }
        requireCanonical(type, type, "Relationship type", ":");
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                throw new DescriptorFormatException(type, "Property key must not be blank");
            }
            if (entry.getValue() == null) {
                throw new DescriptorFormatException(type, "Property '" + key + "' must have a value");
            }
            requireCanonical(type, key, "Property key", "=,");
            requireCanonical(type, entry.getValue(), "Value of property '" + key + "'", ",");
        }
    }

    public static RelationshipDescriptor parse(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            throw new DescriptorFormatException(descriptor, "Relationship type must not be blank");
        }
        int colon = descriptor.indexOf(':');
        String type = (colon < 0 ? descriptor : descriptor.substring(0, colon)).trim();
        if (type.isEmpty()) {
            throw new DescriptorFormatException(descriptor, "Relationship type must not be blank");
        }
        if (colon < 0) {
            return new RelationshipDescriptor(type, Map.of());
        }

        String propertyList = descriptor.substring(colon + 1);
        if (propertyList.isBlank()) {
            return new RelationshipDescriptor(type, Map.of());
        }

        Map<String, String> properties = new LinkedHashMap<>();
        for (String segment : propertyList.split(",", -1)) {
            int eq = segment.indexOf('=');
            if (eq < 0) {
                throw new DescriptorFormatException(
                    descriptor,
                    "Property '" + segment.trim() + "' is not a key=value pair"
                );
            }
            String key = segment.substring(0, eq).trim();
            if (key.isEmpty()) {
                throw new DescriptorFormatException(descriptor, "Property key must not be blank in '" + segment.trim() + "'");
            }
            properties.put(key, segment.substring(eq + 1).trim());
        }
        return new RelationshipDescriptor(type, properties);
    }

    public boolean hasProperties() {
        return !properties.isEmpty();
    }

    public String format() {
        if (properties.isEmpty()) {
            return type;
        }
        return type + ":" + properties.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(","));
    }

    private static void requireCanonical(String type, String text, String what, String reserved) {
        if (!text.equals(text.trim())) {
            throw new DescriptorFormatException(type, what + " '" + text + "' has surrounding whitespace");
        }
        for (char c : reserved.toCharArray()) {
            if (text.indexOf(c) >= 0) {
                throw new DescriptorFormatException(type, what + " '" + text + "' must not contain '" + c + "'");
            }
        }
    }

    @Override
    public String toString() {
        return format();
    }
}
