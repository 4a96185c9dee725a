package io.mongomemory.core.envelope;

public enum ErrorKind {
    CONFIGURATION("Configuration error"),
    VALIDATION("Validation error"),
    NOT_FOUND("Not found"),
    DUPLICATE_KEY("Duplicate key error"),
    MISSING_REFERENCE("Missing reference"),
    FORMAT("Invalid relationship_type format"),
    CONFLICT("Conflict"),
    DATABASE("Database error");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
