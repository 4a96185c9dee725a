package io.mongomemory.core;

public final class MemoryFields {
    public static final String ID = "_id";
    public static final String NAME = "name";
    public static final String TYPE = "type";
    public static final String DESCRIPTION = "description";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    public static final String FROM_ENTITY = "from_entity";
    public static final String TO_ENTITY = "to_entity";
    public static final String PROPERTIES = "properties";

    private MemoryFields() {
    }
}
