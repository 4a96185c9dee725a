package io.mongomemory.mcp.server.provider;

import io.mongomemory.core.entity.EntityStore;
import java.util.List;
import java.util.Map;

public final class EntityToolProvider extends AbstractToolProvider {
    static final int DEFAULT_FIND_LIMIT = 10;

    public EntityToolProvider(EntityStore store) {
        super(
            List.of(
                new ToolOperation(
                    "create_entities",
                    "Create entities in memory. Each entity needs a unique string name; type and data are optional."
                        + FIRST_CALL_HINT,
                    objectSchema(
                        Map.of("entities", Map.of(
                            "type", "array",
                            "description", "Entities to create, e.g. [{\"name\": \"user1\", \"type\": \"user\", \"data\": {}}]",
                            "items", Map.of("type", "object")
                        )),
                        List.of("entities")
                    ),
                    true,
                    args -> store.createEntities(args.requireObjectList("entities"))
                ),
                new ToolOperation(
                    "get_entity",
                    "Get a single entity by its name." + FIRST_CALL_HINT,
                    objectSchema(Map.of("name", property("string", "Unique name of the entity")), List.of("name")),
                    false,
                    args -> store.getEntity(args.requireString("name"))
                ),
                new ToolOperation(
                    "update_entity",
                    "Update a single entity by its name using MongoDB update operators such as $set."
                        + FIRST_CALL_HINT,
                    objectSchema(
                        properties(
                            "name", property("string", "Unique name of the entity to update"),
                            "update", property("object", "Update document, e.g. {\"$set\": {\"data.age\": 26}}"),
                            "upsert", property("boolean", "Create the entity when it does not exist (default false)")
                        ),
                        List.of("name", "update")
                    ),
                    true,
                    args -> store.updateEntity(
                        args.requireString("name"),
                        args.requireObject("update"),
                        args.optionalBoolean("upsert", false)
                    )
                ),
                new ToolOperation(
                    "delete_entity",
                    "Delete a single entity by its name." + FIRST_CALL_HINT,
                    objectSchema(Map.of("name", property("string", "Unique name of the entity to delete")), List.of("name")),
                    true,
                    args -> store.deleteEntity(args.requireString("name"))
                ),
                new ToolOperation(
                    "find_entities",
                    "Find entities matching a non-empty MongoDB query." + FIRST_CALL_HINT,
                    objectSchema(
                        properties(
                            "query", property("object", "MongoDB query, e.g. {\"type\": \"user\"}"),
                            "limit", property("integer", "Maximum number of entities to return (default 10)")
                        ),
                        List.of("query")
                    ),
                    false,
                    args -> store.findEntities(args.requireObject("query"), args.optionalInt("limit", DEFAULT_FIND_LIMIT))
                )
            )
        );
    }

    @Override
    public String name() {
        return "entities";
    }
}
