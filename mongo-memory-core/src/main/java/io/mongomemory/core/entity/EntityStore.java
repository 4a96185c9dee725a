package io.mongomemory.core.entity;

import static io.mongomemory.core.MemoryFields.CREATED_AT;
import static io.mongomemory.core.MemoryFields.NAME;
import static io.mongomemory.core.MemoryFields.UPDATED_AT;

import io.mongomemory.core.config.ConfigurationGate;
import io.mongomemory.core.db.DatabaseException;
import io.mongomemory.core.db.DocumentCollection;
import io.mongomemory.core.db.Documents;
import io.mongomemory.core.db.DuplicateKeyException;
import io.mongomemory.core.db.UpdateOutcome;
import io.mongomemory.core.envelope.ErrorKind;
import io.mongomemory.core.envelope.StoreResult;
import io.mongomemory.core.relationship.RelationshipStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class EntityStore {
    private static final Logger log = LoggerFactory.getLogger(EntityStore.class);

    private final DocumentCollection entities;
    private final DocumentCollection relationships;
    private final ConfigurationGate gate;
    private final Clock clock;
    private final OrphanPolicy orphanPolicy;

    public EntityStore(
        DocumentCollection entities,
        DocumentCollection relationships,
        ConfigurationGate gate,
        Clock clock,
        OrphanPolicy orphanPolicy
    ) {
        this.entities = Objects.requireNonNull(entities, "entities must not be null");
        this.relationships = Objects.requireNonNull(relationships, "relationships must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.orphanPolicy = Objects.requireNonNull(orphanPolicy, "orphanPolicy must not be null");
    }

    public StoreResult createEntities(List<Map<String, Object>> batch) {
        Objects.requireNonNull(batch, "batch must not be null");
        Optional<StoreResult> blocked = gate.check();
        if (blocked.isPresent()) {
            return blocked.get();
        }
        if (batch.isEmpty()) {
            return StoreResult.error(ErrorKind.VALIDATION, "At least one entity is required");
        }

        for (int i = 0; i < batch.size(); i++) {
            StoreResult invalid = validate(batch.get(i), i);
            if (invalid != null) {
                return invalid;
            }
        }

        Date now = Date.from(clock.instant());
        List<Document> documents = new ArrayList<>(batch.size());
        for (Map<String, Object> entity : batch) {
            Document document = Documents.toDocument(entity);
            document.put(CREATED_AT, now);
            document.put(UPDATED_AT, now);
            documents.add(document);
        }

        try {
            int created = entities.insertMany(documents);
            return StoreResult.ok(Map.of("created", created));
        } catch (DuplicateKeyException e) {
            log.warn("Entity batch stopped at index {} after {} insert(s): {}", e.failedIndex(), e.insertedCount(), e.getMessage());
            return StoreResult.error(
                ErrorKind.DUPLICATE_KEY,
                "Duplicate key error: " + e.getMessage(),
                "Entity names must be unique. Use update_entity to change an existing entity.",
                Map.of("created", e.insertedCount(), "failed_index", e.failedIndex())
            );
        } catch (DatabaseException e) {
            return databaseError("create entities", e);
        }
    }

    public StoreResult getEntity(String name) {
        Objects.requireNonNull(name, "name must not be null");
        Optional<StoreResult> blocked = gate.check();
        if (blocked.isPresent()) {
            return blocked.get();
        }
        try {
            Optional<Document> found = entities.findOne(byName(name));
            if (found.isEmpty()) {
                return notFound(name);
            }
            return StoreResult.ok(Map.of("entity", Documents.toPlain(found.get())));
        } catch (DatabaseException e) {
            return databaseError("get entity", e);
        }
    }

    public boolean exists(String name) throws DatabaseException {
        return entities.findOne(byName(name)).isPresent();
    }

    public StoreResult updateEntity(String name, Map<String, Object> update, boolean upsert) {
        Objects.requireNonNull(name, "name must not be null");
        Optional<StoreResult> blocked = gate.check();
        if (blocked.isPresent()) {
            return blocked.get();
        }
        if (update == null || update.isEmpty()) {
            return StoreResult.error(ErrorKind.VALIDATION, "Update document must not be empty");
        }
        for (String key : update.keySet()) {
            if (key == null || !key.startsWith("$")) {
                return StoreResult.error(
                    ErrorKind.VALIDATION,
                    "Update document must only contain update operators, got '" + key + "'",
                    "Wrap field changes in an operator, e.g. {\"$set\": {\"data.value\": 2}}"
                );
            }
        }

        Document prepared = Documents.toDocument(update);
        Object rawSet = prepared.get("$set");
        Document set;
        if (rawSet == null) {
            set = new Document();
        } else if (rawSet instanceof Document document) {
            set = document;
        } else {
            return StoreResult.error(ErrorKind.VALIDATION, "$set must be an object");
        }
        if (!set.containsKey(UPDATED_AT)) {
            set.put(UPDATED_AT, Date.from(clock.instant()));
        }
        prepared.put("$set", set);

        try {
            UpdateOutcome outcome = entities.updateOne(byName(name), prepared, upsert);
            if (outcome.matchedCount() > 0 || (upsert && outcome.upserted())) {
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("matched_count", outcome.matchedCount());
                fields.put("modified_count", outcome.modifiedCount());
                if (outcome.upserted()) {
                    fields.put("upserted_id", Documents.idString(outcome.upsertedId()));
                }
                return StoreResult.ok(fields);
            }
            return StoreResult.error(
                ErrorKind.NOT_FOUND,
                "Entity '" + name + "' not found",
                "Pass upsert=true to create the entity when it does not exist"
            );
        } catch (DuplicateKeyException e) {
            return StoreResult.error(
                ErrorKind.DUPLICATE_KEY,
                "Duplicate key error: " + e.getMessage(),
                "Another entity already uses that name"
            );
        } catch (DatabaseException e) {
            return databaseError("update entity", e);
        }
    }

    public StoreResult deleteEntity(String name) {
        Objects.requireNonNull(name, "name must not be null");
        Optional<StoreResult> blocked = gate.check();
        if (blocked.isPresent()) {
            return blocked.get();
        }
        try {
            if (orphanPolicy == OrphanPolicy.REJECT) {
                if (!exists(name)) {
                    return notFound(name);
                }
                long references = relationships.count(RelationshipStore.touching(name));
                if (references > 0) {
                    return StoreResult.error(
                        ErrorKind.CONFLICT,
                        "Entity '" + name + "' is referenced by " + references + " relationship(s)",
                        "Delete its relationships first",
                        Map.of("relationship_count", references)
                    );
                }
            }

            long deleted = entities.deleteOne(byName(name));
            if (deleted == 0) {
                return notFound(name);
            }
            if (orphanPolicy == OrphanPolicy.CASCADE) {
                long removed = relationships.deleteMany(RelationshipStore.touching(name));
                log.debug("Cascaded delete of entity {} removed {} relationship(s)", name, removed);
                return StoreResult.ok(Map.of("deleted_count", deleted, "relationships_deleted", removed));
            }
            return StoreResult.ok(Map.of("deleted_count", deleted));
        } catch (DatabaseException e) {
            return databaseError("delete entity", e);
        }
    }

    public StoreResult findEntities(Map<String, Object> query, int limit) {
        Optional<StoreResult> blocked = gate.check();
        if (blocked.isPresent()) {
            return blocked.get();
        }
        if (query == null || query.isEmpty()) {
            return StoreResult.error(
                ErrorKind.VALIDATION,
                "Query must be a non-empty object",
                "Filter on at least one field, e.g. {\"type\": \"person\"}"
            );
        }
        if (limit < 1) {
            return StoreResult.error(ErrorKind.VALIDATION, "Limit must be a positive number");
        }
        try {
            List<Map<String, Object>> found = Documents.toPlain(entities.find(Documents.toDocument(query), limit));
            return StoreResult.ok(Map.of("entities", found, "count", found.size()));
        } catch (DatabaseException e) {
            return databaseError("find entities", e);
        }
    }

    private StoreResult validate(Map<String, Object> entity, int index) {
        if (entity == null) {
            return StoreResult.error(ErrorKind.VALIDATION, "Entity at index " + index + " is null", null, Map.of("index", index));
        }
        Object name = entity.get(NAME);
        if (name == null) {
            return StoreResult.error(
                ErrorKind.VALIDATION,
                "Missing required field: " + NAME,
                "Every entity needs a unique string name",
                Map.of("index", index)
            );
        }
        if (!(name instanceof String)) {
            return StoreResult.error(
                ErrorKind.VALIDATION,
                "Field " + NAME + " must be a string",
                "Got " + name.getClass().getSimpleName() + " at index " + index,
                Map.of("index", index)
            );
        }
        return null;
    }

    private static Document byName(String name) {
        return new Document(NAME, name);
    }

    private static StoreResult notFound(String name) {
        return StoreResult.error(ErrorKind.NOT_FOUND, "Entity '" + name + "' not found");
    }

    private static StoreResult databaseError(String operation, DatabaseException e) {
        log.warn("Failed to {}: {}", operation, e.getMessage());
        return StoreResult.error(ErrorKind.DATABASE, e.getMessage(), "A MongoDB error occurred while trying to " + operation);
    }
}
