package io.mongomemory.core.db;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.ObjectId;

public final class Documents {

    private Documents() {
    }

    public static Map<String, Object> toPlain(Map<String, ?> document) {
        Map<String, Object> out = new LinkedHashMap<>();
        document.forEach((key, value) -> out.put(key, plainValue(value)));
        return out;
    }

    public static List<Map<String, Object>> toPlain(List<Document> documents) {
        List<Map<String, Object>> out = new ArrayList<>(documents.size());
        for (Document document : documents) {
            out.add(toPlain(document));
        }
        return out;
    }

    public static String idString(Object id) {
        if (id == null) {
            return null;
        }
        if (id instanceof ObjectId objectId) {
            return objectId.toHexString();
        }
        if (id instanceof BsonValue bson) {
            if (bson.isObjectId()) {
                return bson.asObjectId().getValue().toHexString();
            }
            if (bson.isString()) {
                return bson.asString().getValue();
            }
        }
        return String.valueOf(id);
    }

    public static Document toDocument(Map<?, ?> source) {
        Document document = new Document();
        source.forEach((key, value) -> document.put(String.valueOf(key), documentValue(value)));
        return document;
    }

    @SuppressWarnings("unchecked")
    private static Object plainValue(Object value) {
        if (value instanceof ObjectId || value instanceof BsonValue) {
            return idString(value);
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Map<?, ?> map) {
            return toPlain((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> out = new ArrayList<>(collection.size());
            for (Object item : collection) {
                out.add(plainValue(item));
            }
            return out;
        }
        return value;
    }

    private static Object documentValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return toDocument(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> out = new ArrayList<>(collection.size());
            for (Object item : collection) {
                out.add(documentValue(item));
            }
            return out;
        }
        return value;
    }
}
