package io.mongomemory.core.db;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

class DocumentsTest {

    @Test
    void plainMapsCarryHexIdsAndInstants() {
        ObjectId id = new ObjectId();
        Instant at = Instant.parse("2026-02-02T02:02:02Z");
        Document stored = new Document("_id", id)
            .append("created_at", Date.from(at))
            .append("data", new Document("refs", List.of(new ObjectId(id.toHexString()), "x")));

        Map<String, Object> plain = Documents.toPlain(stored);

        assertThat(plain).containsEntry("_id", id.toHexString()).containsEntry("created_at", at);
        assertThat(plain.get("data")).isEqualTo(Map.of("refs", List.of(id.toHexString(), "x")));
    }

    @Test
    void idStringHandlesBsonValues() {
        ObjectId id = new ObjectId();

        assertThat(Documents.idString(new BsonObjectId(id))).isEqualTo(id.toHexString());
        assertThat(Documents.idString(new BsonString("custom"))).isEqualTo("custom");
        assertThat(Documents.idString(null)).isNull();
    }

    @Test
    void toDocumentConvertsNestedMaps() {
        Document document = Documents.toDocument(Map.of("data", Map.of("age", 3), "tags", List.of(Map.of("k", "v"))));

        assertThat(document.get("data")).isInstanceOf(Document.class);
        assertThat(document.getList("tags", Object.class).get(0)).isInstanceOf(Document.class);
    }
}
