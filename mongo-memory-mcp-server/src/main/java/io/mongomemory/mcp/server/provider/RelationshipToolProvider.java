package io.mongomemory.mcp.server.provider;

import io.mongomemory.core.relationship.RelationshipDescriptor;
import io.mongomemory.core.relationship.RelationshipStore;
import java.util.List;

public final class RelationshipToolProvider extends AbstractToolProvider {
    static final int DEFAULT_PAGE_SIZE = 10;

    public RelationshipToolProvider(RelationshipStore store) {
        super(
            List.of(
                new ToolOperation(
                    "create_relationship",
                    "Create a relationship between two existing entities. relationship_type uses the format \""
                        + RelationshipDescriptor.EXPECTED_FORMAT
                        + "\", e.g. \"works_at:position=developer,department=RnD\" or simply \"knows\"."
                        + FIRST_CALL_HINT,
                    objectSchema(
                        properties(
                            "from_entity", property("string", "Name of the source entity"),
                            "to_entity", property("string", "Name of the target entity"),
                            "relationship_type", property("string", "Type and optional properties of the relationship"),
                            "properties", property("object", "Extra string properties; those in relationship_type win")
                        ),
                        List.of("from_entity", "to_entity", "relationship_type")
                    ),
                    true,
                    args -> store.createRelationship(
                        args.requireString("from_entity"),
                        args.requireString("to_entity"),
                        args.requireString("relationship_type"),
                        args.optionalStringMap("properties")
                    )
                ),
                new ToolOperation(
                    "get_relationships",
                    "Get relationships up to the given limit, with the total count and whether more exist."
                        + " Filter the results yourself or pass an optional query." + FIRST_CALL_HINT,
                    objectSchema(
                        properties(
                            "limit", property("integer", "Maximum number of relationships to return, 1 to "
                                + RelationshipStore.MAX_PAGE_SIZE + " (default " + DEFAULT_PAGE_SIZE + ")"),
                            "query", property("object", "Optional MongoDB query, e.g. {\"type\": \"works_at\"}")
                        ),
                        List.of()
                    ),
                    false,
                    args -> store.getRelationships(args.optionalObject("query"), args.optionalInt("limit", DEFAULT_PAGE_SIZE))
                ),
                new ToolOperation(
                    "delete_relationship",
                    "Delete a relationship between two entities. When relationship_type carries properties they must"
                        + " match the stored properties exactly." + FIRST_CALL_HINT,
                    objectSchema(
                        properties(
                            "from_entity", property("string", "Name of the source entity"),
                            "to_entity", property("string", "Name of the target entity"),
                            "relationship_type", property("string", "Type of the relationship to delete")
                        ),
                        List.of("from_entity", "to_entity", "relationship_type")
                    ),
                    true,
                    args -> store.deleteRelationship(
                        args.requireString("from_entity"),
                        args.requireString("to_entity"),
                        args.requireString("relationship_type")
                    )
                )
            )
        );
    }

    @Override
    public String name() {
        return "relationships";
    }
}
