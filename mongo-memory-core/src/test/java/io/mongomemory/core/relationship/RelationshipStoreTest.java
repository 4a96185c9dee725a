package io.mongomemory.core.relationship;

import static org.assertj.core.api.Assertions.assertThat;

import io.mongomemory.core.config.ConfigurationGate;
import io.mongomemory.core.db.DatabaseException;
import io.mongomemory.core.db.InMemoryDocumentCollection;
import io.mongomemory.core.entity.EntityStore;
import io.mongomemory.core.entity.OrphanPolicy;
import io.mongomemory.core.envelope.ErrorKind;
import io.mongomemory.core.envelope.StoreResult;
import io.mongomemory.core.schema.SchemaBootstrapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RelationshipStoreTest {
    private static final Instant NOW = Instant.parse("2026-04-10T12:00:00Z");

    private InMemoryDocumentCollection entityCollection;
    private InMemoryDocumentCollection relationships;
    private SchemaBootstrapper bootstrapper;
    private RelationshipStore store;

    @BeforeEach
    void setUp() throws Exception {
        entityCollection = new InMemoryDocumentCollection("entities");
        relationships = new InMemoryDocumentCollection("relationships");
        bootstrapper = new SchemaBootstrapper(entityCollection, relationships);
        bootstrapper.bootstrapEntities();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        EntityStore entities = new EntityStore(entityCollection, relationships, ConfigurationGate.open(), clock, OrphanPolicy.KEEP);
        store = new RelationshipStore(relationships, entities, bootstrapper, ConfigurationGate.open(), clock);

        for (String name : List.of("alice", "bob", "acme")) {
            Map<String, Object> entity = new LinkedHashMap<>();
            entity.put("name", name);
            assertThat(entities.createEntities(List.of(entity)).success()).isTrue();
        }
    }

    @Test
    void createStoresTheParsedDescriptorAndEnsuresIndexes() {
        StoreResult result = store.createRelationship("alice", "acme", "works_for:since=2020,role=engineer", null);

        assertThat(result.success()).isTrue();
        assertThat(result.field("acknowledged")).isEqualTo(true);
        assertThat((String) result.field("inserted_id")).hasSize(24);
        assertThat(bootstrapper.relationshipIndexesReady()).isTrue();

        Document stored = relationships.documents().get(0);
        assertThat(stored.getString("from_entity")).isEqualTo("alice");
        assertThat(stored.getString("to_entity")).isEqualTo("acme");
        assertThat(stored.getString("type")).isEqualTo("works_for");
        assertThat(stored.get("properties")).isEqualTo(new Document("since", "2020").append("role", "engineer"));
        assertThat(stored.get("created_at")).isEqualTo(Date.from(NOW));
    }

    @Test
    void descriptorPropertiesOverrideSuppliedOnes() {
        Map<String, String> supplied = new LinkedHashMap<>();
        supplied.put("since", "2019");
        supplied.put("office", "remote");

        store.createRelationship("alice", "acme", "works_for:since=2020", supplied);

        Document properties = relationships.documents().get(0).get("properties", Document.class);
        assertThat(properties).containsExactly(Map.entry("since", "2020"), Map.entry("office", "remote"));
    }

    @Test
    void missingEndpointsAreReportedWithoutWriting() {
        StoreResult source = store.createRelationship("ghost", "acme", "works_for", null);
        StoreResult target = store.createRelationship("alice", "ghost", "works_for", null);

        assertThat(source.kind()).isEqualTo(ErrorKind.MISSING_REFERENCE);
        assertThat(source.message()).isEqualTo("Source entity 'ghost' does not exist");
        assertThat(target.kind()).isEqualTo(ErrorKind.MISSING_REFERENCE);
        assertThat(target.message()).isEqualTo("Target entity 'ghost' does not exist");
        assertThat(relationships.documents()).isEmpty();
        assertThat(bootstrapper.relationshipIndexesReady()).isFalse();
    }

    @Test
    void blankArgumentsAreValidationErrors() {
        assertThat(store.createRelationship(" ", "acme", "works_for", null).kind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(store.createRelationship("alice", null, "works_for", null).kind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(store.deleteRelationship("alice", "acme", "").kind()).isEqualTo(ErrorKind.VALIDATION);
    }

    @Test
    void malformedDescriptorsAreRejectedOnCreateAndDelete() {
        StoreResult create = store.createRelationship("alice", "acme", "works_for:since", null);
        StoreResult delete = store.deleteRelationship("alice", "acme", "works_for:since=2020,");

        for (StoreResult result : List.of(create, delete)) {
            assertThat(result.kind()).isEqualTo(ErrorKind.FORMAT);
            assertThat(result.details()).isEqualTo("Expected format: type:key1=value1,key2=value2");
            assertThat(result.toMap()).containsEntry("error", "Invalid relationship_type format");
        }
        assertThat(relationships.documents()).isEmpty();
    }

    @Test
    void sameTripleWithDifferentPropertiesIsADuplicate() {
        assertThat(store.createRelationship("alice", "acme", "works_for:since=2020", null).success()).isTrue();

        StoreResult duplicate = store.createRelationship("alice", "acme", "works_for:since=2024", null);
        StoreResult otherDirection = store.createRelationship("acme", "alice", "works_for", null);

        assertThat(duplicate.kind()).isEqualTo(ErrorKind.DUPLICATE_KEY);
        assertThat(duplicate.message()).startsWith("Duplicate key error: ");
        assertThat(otherDirection.success()).isTrue();
        assertThat(relationships.documents()).hasSize(2);
    }

    @Test
    void pagesThroughRelationshipsWithALookahead() {
        for (int i = 0; i < 15; i++) {
            assertThat(store.createRelationship("alice", "bob", "type_" + i, null).success()).isTrue();
        }

        StoreResult page = store.getRelationships(null, 5);

        assertThat(page.success()).isTrue();
        assertThat(page.field("total_count")).isEqualTo(15L);
        List<Map<String, Object>> returned = relationshipsOf(page);
        assertThat(returned).hasSize(5);
        Map<String, Object> pageInfo = pageInfo(page);
        assertThat(pageInfo).containsEntry("has_next", true);
        assertThat(pageInfo.get("next_cursor")).isEqualTo(returned.get(4).get("_id"));

        StoreResult everything = store.getRelationships(Map.of(), 15);
        assertThat(relationshipsOf(everything)).hasSize(15);
        assertThat(pageInfo(everything)).containsEntry("has_next", false).containsEntry("next_cursor", null);
    }

    @Test
    void filtersRelationshipsByQuery() {
        store.createRelationship("alice", "acme", "works_for", null);
        store.createRelationship("bob", "acme", "works_for", null);
        store.createRelationship("alice", "bob", "knows", null);

        StoreResult result = store.getRelationships(Map.of("to_entity", "acme"), 10);

        assertThat(result.field("total_count")).isEqualTo(2L);
        assertThat(relationshipsOf(result)).extracting(relationship -> relationship.get("from_entity"))
            .containsExactly("alice", "bob");
    }

    @Test
    void limitOutsideRangeIsRejectedBeforeQuerying() {
        int before = relationships.calls();

        assertThat(store.getRelationships(null, 0).kind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(store.getRelationships(null, 101).kind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(store.getRelationships(null, 100).success()).isTrue();
        assertThat(relationships.calls()).isEqualTo(before + 2);
    }

    @Test
    void listingFailureStillCarriesAnEmptyPage() {
        relationships.breakWith(new DatabaseException("not primary"));

        StoreResult result = store.getRelationships(null, 10);

        assertThat(result.kind()).isEqualTo(ErrorKind.DATABASE);
        assertThat(relationshipsOf(result)).isEmpty();
        assertThat(result.field("total_count")).isEqualTo(0L);
        assertThat(pageInfo(result)).containsEntry("has_next", false).containsEntry("next_cursor", null);
    }

    @Test
    void deleteWithoutPropertiesMatchesTheTriple() {
        store.createRelationship("alice", "acme", "works_for:since=2020", null);

        StoreResult result = store.deleteRelationship("alice", "acme", "works_for");

        assertThat(result.success()).isTrue();
        assertThat(result.toMap()).containsEntry("error", null);
        assertThat(result.field("deleted_count")).isEqualTo(1L);
        assertThat(relationships.documents()).isEmpty();
    }

    @Test
    void deleteWithPropertiesRequiresTheWholeMap() {
        store.createRelationship("alice", "acme", "works_for:since=2020,role=engineer", null);

        StoreResult partial = store.deleteRelationship("alice", "acme", "works_for:since=2020");
        StoreResult different = store.deleteRelationship("alice", "acme", "works_for:since=2021,role=engineer");
        StoreResult reordered = store.deleteRelationship("alice", "acme", "works_for:role=engineer,since=2020");
        StoreResult exact = store.deleteRelationship("alice", "acme", "works_for: since = 2020 , role = engineer");

        assertThat(partial.success()).isTrue();
        assertThat(partial.field("deleted_count")).isEqualTo(0L);
        assertThat(different.field("deleted_count")).isEqualTo(0L);
        assertThat(reordered.field("deleted_count")).isEqualTo(0L);
        assertThat(exact.field("deleted_count")).isEqualTo(1L);
    }

    @Test
    void deleteChecksEndpointsLikeCreate() {
        StoreResult result = store.deleteRelationship("alice", "ghost", "knows");

        assertThat(result.kind()).isEqualTo(ErrorKind.MISSING_REFERENCE);
        assertThat(result.message()).isEqualTo("Target entity 'ghost' does not exist");
    }

    @Test
    void deleteFailureIsNotAcknowledged() {
        store.createRelationship("alice", "acme", "works_for", null);
        relationships.breakWith(new DatabaseException("write concern timeout"));

        StoreResult result = store.deleteRelationship("alice", "acme", "works_for");

        assertThat(result.kind()).isEqualTo(ErrorKind.DATABASE);
        assertThat(result.fields()).containsEntry("acknowledged", false).containsEntry("deleted_count", 0L);
    }

    @Test
    void failedIndexStepIsReportedAndRetriedOnTheNextCreate() {
        relationships.breakWith(new DatabaseException("index boom"));

        StoreResult failed = store.createRelationship("alice", "acme", "works_for", null);

        assertThat(failed.kind()).isEqualTo(ErrorKind.DATABASE);
        assertThat(failed.toMap()).containsEntry("error", "Database error").containsEntry("message", "index boom");
        assertThat(bootstrapper.relationshipIndexesReady()).isFalse();

        relationships.breakWith(null);
        StoreResult retried = store.createRelationship("alice", "acme", "works_for", null);

        assertThat(retried.success()).isTrue();
        assertThat(bootstrapper.relationshipIndexesReady()).isTrue();
        assertThat(relationships.indexesCreated()).isEqualTo(4);
        assertThat(relationships.documents()).hasSize(1);
    }

    @Test
    void touchingMatchesEitherEnd() {
        assertThat(RelationshipStore.touching("alice")).isEqualTo(new Document(
            "$or",
            List.of(new Document("from_entity", "alice"), new Document("to_entity", "alice"))
        ));
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> relationshipsOf(StoreResult result) {
        return (List<Map<String, Object>>) result.field("relationships");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> pageInfo(StoreResult result) {
        return (Map<String, Object>) result.field("page_info");
    }
}
