package io.mongomemory.core.schema;

import static io.mongomemory.core.MemoryFields.FROM_ENTITY;
import static io.mongomemory.core.MemoryFields.NAME;
import static io.mongomemory.core.MemoryFields.TO_ENTITY;
import static io.mongomemory.core.MemoryFields.TYPE;

import io.mongomemory.core.db.DatabaseException;
import io.mongomemory.core.db.DocumentCollection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SchemaBootstrapper {
    private static final Logger log = LoggerFactory.getLogger(SchemaBootstrapper.class);

    private final DocumentCollection entities;
    private final DocumentCollection relationships;
    private final Object relationshipLock = new Object();
    private volatile boolean relationshipIndexesReady;

    public SchemaBootstrapper(DocumentCollection entities, DocumentCollection relationships) {
        this.entities = entities;
        this.relationships = relationships;
    }

    public void bootstrapEntities() throws DatabaseException {
        Document nameKey = new Document(NAME, 1);
        if (hasIndex(entities.listIndexes(), nameKey, true)) {
            log.debug("Unique index on {}.{} already present", entities.name(), NAME);
        } else {
            entities.createIndex(nameKey, true);
            log.info("Created unique index on {}.{}", entities.name(), NAME);
        }

        if (entities.validator().isPresent()) {
            log.debug("Validator on {} already present", entities.name());
        } else {
            entities.applyValidator(entityValidator());
            log.info("Applied required-field validator to {}", entities.name());
        }
    }

    // runs once; a failed attempt leaves the flag unset so the next write retries
    public void ensureRelationshipIndexes() throws DatabaseException {
        if (relationshipIndexesReady) {
            return;
        }
        synchronized (relationshipLock) {
            if (relationshipIndexesReady) {
                return;
            }
            List<Document> existing = relationships.listIndexes();
            for (String field : List.of(FROM_ENTITY, TO_ENTITY, TYPE)) {
                Document keys = new Document(field, 1);
                if (!hasIndex(existing, keys, false)) {
                    relationships.createIndex(keys, false);
                    log.info("Created index on {}.{}", relationships.name(), field);
                }
            }
            Document triple = new Document(FROM_ENTITY, 1).append(TO_ENTITY, 1).append(TYPE, 1);
            if (!hasIndex(existing, triple, true)) {
                relationships.createIndex(triple, true);
                log.info("Created unique index on {}({}, {}, {})", relationships.name(), FROM_ENTITY, TO_ENTITY, TYPE);
            }
            relationshipIndexesReady = true;
        }
    }

    public boolean relationshipIndexesReady() {
        return relationshipIndexesReady;
    }

    public static Document entityValidator() {
        return new Document(
            "$jsonSchema",
            new Document("bsonType", "object")
                .append("required", List.of(NAME))
                .append(
                    "properties",
                    new Document(
                        NAME,
                        new Document("bsonType", "string")
                            .append("description", "Unique name of the entity - required field")
                    )
                )
        );
    }

    static boolean hasIndex(List<Document> indexes, Document keys, boolean requireUnique) {
        for (Document index : indexes) {
            Object raw = index.get("key");
            if (!(raw instanceof Map<?, ?> indexKeys) || !sameKeys(indexKeys, keys)) {
                continue;
            }
            if (!requireUnique || Boolean.TRUE.equals(index.get("unique"))) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameKeys(Map<?, ?> actual, Document expected) {
        if (actual.size() != expected.size()) {
            return false;
        }
        List<?> actualFields = new ArrayList<>(actual.keySet());
        List<String> expectedFields = new ArrayList<>(expected.keySet());
        if (!actualFields.equals(expectedFields)) {
            return false;
        }
        for (String field : expectedFields) {
            if (!(actual.get(field) instanceof Number direction)
                || direction.intValue() != ((Number) expected.get(field)).intValue()) {
                return false;
            }
        }
        return true;
    }
}
