package io.mongomemory.core.structure;

import static io.mongomemory.core.MemoryFields.DESCRIPTION;
import static io.mongomemory.core.MemoryFields.ID;
import static io.mongomemory.core.MemoryFields.NAME;

import io.mongomemory.core.config.ConfigurationGate;
import io.mongomemory.core.db.DatabaseException;
import io.mongomemory.core.db.DocumentCollection;
import io.mongomemory.core.db.Documents;
import io.mongomemory.core.envelope.ErrorKind;
import io.mongomemory.core.envelope.StoreResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MemoryStructureService {
    private static final Logger log = LoggerFactory.getLogger(MemoryStructureService.class);

    static final String STRUCTURE_FLAG = "structure";
    private static final Set<String> SKIPPED_FIELDS = Set.of(ID, NAME, DESCRIPTION);
    // BSON order: numbers, then strings, then booleans; equal text only merges within one kind
    private static final Comparator<Object> BY_KIND_THEN_TEXT = Comparator
        .<Object>comparingInt(MemoryStructureService::kindRank)
        .thenComparing(Object::toString);

    private final DocumentCollection system;
    private final DocumentCollection entities;
    private final ConfigurationGate gate;
    private final int sampleSize;

    public MemoryStructureService(
        DocumentCollection system,
        DocumentCollection entities,
        ConfigurationGate gate,
        int sampleSize
    ) {
        this.system = Objects.requireNonNull(system, "system must not be null");
        this.entities = Objects.requireNonNull(entities, "entities must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be positive");
        }
        this.sampleSize = sampleSize;
    }

    public StoreResult getMemoryStructure() {
        Optional<StoreResult> blocked = gate.check();
        if (blocked.isPresent()) {
            return blocked.get();
        }
        try {
            Optional<Document> configured = system.findOne(new Document(STRUCTURE_FLAG, true));
            if (configured.isPresent()) {
                Map<String, Object> structure = Documents.toPlain(configured.get());
                structure.remove(ID);
                structure.remove(STRUCTURE_FLAG);
                return result("configured", structure);
            }
            return result("derived", derive(entities.find(new Document(), sampleSize)));
        } catch (DatabaseException e) {
            log.warn("Failed to read memory structure: {}", e.getMessage());
            return StoreResult.error(ErrorKind.DATABASE, e.getMessage(), "A MongoDB error occurred while reading the memory structure");
        }
    }

    static Map<String, Object> derive(List<Document> sample) {
        Map<String, Set<Object>> valuesByField = new TreeMap<>();
        for (Document entity : sample) {
            for (Map.Entry<String, Object> entry : entity.entrySet()) {
                if (SKIPPED_FIELDS.contains(entry.getKey())) {
                    continue;
                }
                collect(valuesByField, entry.getKey(), entry.getValue());
            }
        }

        List<Map<String, Object>> fields = new ArrayList<>(valuesByField.size());
        valuesByField.forEach((field, values) -> {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("field", field);
            summary.put("values", new ArrayList<>(values));
            fields.add(summary);
        });

        Map<String, Object> structure = new LinkedHashMap<>();
        structure.put("fields", fields);
        structure.put("sampled", sample.size());
        return structure;
    }

    private static void collect(Map<String, Set<Object>> valuesByField, String field, Object value) {
        if (value == null || value instanceof Date || value instanceof Map<?, ?>) {
            return;
        }
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                collect(valuesByField, field, item);
            }
            return;
        }
        valuesByField
            .computeIfAbsent(field, key -> new TreeSet<>(BY_KIND_THEN_TEXT))
            .add(scalar(value));
    }

    private static Object scalar(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return Documents.idString(value);
    }

    private static int kindRank(Object value) {
        if (value instanceof Number) {
            return 0;
        }
        if (value instanceof Boolean) {
            return 2;
        }
        return 1;
    }

    private static StoreResult result(String source, Map<String, Object> structure) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("source", source);
        fields.put("structure", structure);
        return StoreResult.ok(fields);
    }
}
