package io.mongomemory.core.relationship;

import static io.mongomemory.core.MemoryFields.CREATED_AT;
import static io.mongomemory.core.MemoryFields.FROM_ENTITY;
import static io.mongomemory.core.MemoryFields.ID;
import static io.mongomemory.core.MemoryFields.PROPERTIES;
import static io.mongomemory.core.MemoryFields.TO_ENTITY;
import static io.mongomemory.core.MemoryFields.TYPE;

import io.mongomemory.core.config.ConfigurationGate;
import io.mongomemory.core.db.DatabaseException;
import io.mongomemory.core.db.DocumentCollection;
import io.mongomemory.core.db.Documents;
import io.mongomemory.core.db.DuplicateKeyException;
import io.mongomemory.core.entity.EntityStore;
import io.mongomemory.core.envelope.ErrorKind;
import io.mongomemory.core.envelope.StoreResult;
import io.mongomemory.core.schema.SchemaBootstrapper;
import java.time.Clock;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RelationshipStore {
    private static final Logger log = LoggerFactory.getLogger(RelationshipStore.class);

    public static final int MAX_PAGE_SIZE = 100;

    private final DocumentCollection relationships;
    private final EntityStore entities;
    private final SchemaBootstrapper bootstrapper;
    private final ConfigurationGate gate;
    private final Clock clock;

    public RelationshipStore(
        DocumentCollection relationships,
        EntityStore entities,
        SchemaBootstrapper bootstrapper,
        ConfigurationGate gate,
        Clock clock
    ) {
        this.relationships = Objects.requireNonNull(relationships, "relationships must not be null");
        this.entities = Objects.requireNonNull(entities, "entities must not be null");
        this.bootstrapper = Objects.requireNonNull(bootstrapper, "bootstrapper must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static Document touching(String name) {
        return new Document("$or", List.of(new Document(FROM_ENTITY, name), new Document(TO_ENTITY, name)));
    }

    public StoreResult createRelationship(String from, String to, String descriptor, Map<String, String> properties) {
        Optional<StoreResult> blocked = gate.check();
        if (blocked.isPresent()) {
            return blocked.get();
        }
        StoreResult invalid = validateArguments(from, to, descriptor);
        if (invalid != null) {
            return invalid;
        }

        try {
            StoreResult missing = checkEndpoints(from, to);
            if (missing != null) {
                return missing;
            }
            RelationshipDescriptor parsed = RelationshipDescriptor.parse(descriptor);

            Map<String, String> merged = new LinkedHashMap<>();
            if (properties != null) {
                merged.putAll(properties);
            }
            merged.putAll(parsed.properties());

            Document relationship = new Document(FROM_ENTITY, from)
                .append(TO_ENTITY, to)
                .append(TYPE, parsed.type())
                .append(PROPERTIES, new Document(new LinkedHashMap<String, Object>(merged)))
                .append(CREATED_AT, Date.from(clock.instant()));

            bootstrapper.ensureRelationshipIndexes();
            Object insertedId = relationships.insertOne(relationship);
            log.debug("Created relationship {} -[{}]-> {}", from, parsed.type(), to);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("acknowledged", true);
            fields.put("inserted_id", Documents.idString(insertedId));
            return StoreResult.ok(fields);
        } catch (DescriptorFormatException e) {
            return formatError(e);
        } catch (DuplicateKeyException e) {
            return StoreResult.error(
                ErrorKind.DUPLICATE_KEY,
                "Duplicate key error: " + e.getMessage(),
                "A relationship of this type already exists between '" + from + "' and '" + to + "'"
            );
        } catch (DatabaseException e) {
            log.warn("Failed to create relationship {} -> {}: {}", from, to, e.getMessage());
            return StoreResult.error(ErrorKind.DATABASE, e.getMessage(), "A MongoDB error occurred while creating the relationship");
        }
    }

    // fetches limit + 1 to decide has_next
    public StoreResult getRelationships(Map<String, Object> query, int limit) {
        Optional<StoreResult> blocked = gate.check();
        if (blocked.isPresent()) {
            return blocked.get();
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            return StoreResult.error(
                ErrorKind.VALIDATION,
                "Limit must be between 1 and " + MAX_PAGE_SIZE,
                "Got " + limit
            );
        }

        Document filter = query == null ? new Document() : Documents.toDocument(query);
        try {
            long total = relationships.count(filter);
            List<Document> fetched = relationships.find(filter, limit + 1);
            boolean hasNext = fetched.size() > limit;
            List<Document> page = hasNext ? fetched.subList(0, limit) : fetched;
            String nextCursor = hasNext ? Documents.idString(page.get(page.size() - 1).get(ID)) : null;

            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("relationships", Documents.toPlain(page));
            fields.put("total_count", total);
            fields.put("page_info", pageInfo(hasNext, nextCursor));
            return StoreResult.ok(fields);
        } catch (DatabaseException e) {
            log.warn("Failed to list relationships: {}", e.getMessage());
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("relationships", List.of());
            fields.put("total_count", 0L);
            fields.put("page_info", pageInfo(false, null));
            return StoreResult.error(
                ErrorKind.DATABASE,
                e.getMessage(),
                "A MongoDB error occurred while listing relationships",
                fields
            );
        }
    }

    public StoreResult deleteRelationship(String from, String to, String descriptor) {
        Optional<StoreResult> blocked = gate.check();
        if (blocked.isPresent()) {
            return blocked.get();
        }
        StoreResult invalid = validateArguments(from, to, descriptor);
        if (invalid != null) {
            return invalid;
        }

        try {
            StoreResult missing = checkEndpoints(from, to);
            if (missing != null) {
                return missing;
            }
            RelationshipDescriptor parsed = RelationshipDescriptor.parse(descriptor);

            Document filter = new Document(FROM_ENTITY, from)
                .append(TO_ENTITY, to)
                .append(TYPE, parsed.type());
            if (parsed.hasProperties()) {
                filter.append(PROPERTIES, new Document(new LinkedHashMap<String, Object>(parsed.properties())));
            }

            long deleted = relationships.deleteOne(filter);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("acknowledged", true);
            fields.put("deleted_count", deleted);
            fields.put("error", null);
            return StoreResult.ok(fields);
        } catch (DescriptorFormatException e) {
            return formatError(e);
        } catch (DatabaseException e) {
            log.warn("Failed to delete relationship {} -> {}: {}", from, to, e.getMessage());
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("acknowledged", false);
            fields.put("deleted_count", 0L);
            return StoreResult.error(
                ErrorKind.DATABASE,
                e.getMessage(),
                "A MongoDB error occurred while deleting the relationship",
                fields
            );
        }
    }

    private StoreResult checkEndpoints(String from, String to) throws DatabaseException {
        if (!entities.exists(from)) {
            return StoreResult.error(
                ErrorKind.MISSING_REFERENCE,
                "Source entity '" + from + "' does not exist",
                "Create the entity before relating it"
            );
        }
        if (!entities.exists(to)) {
            return StoreResult.error(
                ErrorKind.MISSING_REFERENCE,
                "Target entity '" + to + "' does not exist",
                "Create the entity before relating it"
            );
        }
        return null;
    }

    private static StoreResult validateArguments(String from, String to, String descriptor) {
        if (isBlank(from)) {
            return StoreResult.error(ErrorKind.VALIDATION, "from_entity must not be blank");
        }
        if (isBlank(to)) {
            return StoreResult.error(ErrorKind.VALIDATION, "to_entity must not be blank");
        }
        if (isBlank(descriptor)) {
            return StoreResult.error(ErrorKind.VALIDATION, "relationship_type must not be blank");
        }
        return null;
    }

    private static StoreResult formatError(DescriptorFormatException e) {
        return StoreResult.error(
            ErrorKind.FORMAT,
            e.getMessage(),
            "Expected format: " + RelationshipDescriptor.EXPECTED_FORMAT
        );
    }

    private static Map<String, Object> pageInfo(boolean hasNext, String nextCursor) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("has_next", hasNext);
        info.put("next_cursor", nextCursor);
        return info;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
