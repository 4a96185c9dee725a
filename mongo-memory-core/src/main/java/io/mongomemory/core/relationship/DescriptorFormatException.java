package io.mongomemory.core.relationship;

public final class DescriptorFormatException extends IllegalArgumentException {
    private final String descriptor;

    public DescriptorFormatException(String descriptor, String message) {
        super(message);
        this.descriptor = descriptor;
    }

    public String descriptor() {
        return descriptor;
    }
}
