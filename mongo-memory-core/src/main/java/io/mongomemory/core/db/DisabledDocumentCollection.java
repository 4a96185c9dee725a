package io.mongomemory.core.db;

import java.util.List;
import java.util.Optional;
import org.bson.Document;

public final class DisabledDocumentCollection implements DocumentCollection {
    private final String name;
    private final String reason;

    public DisabledDocumentCollection(String name, String reason) {
        this.name = name;
        this.reason = reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int insertMany(List<Document> documents) throws DatabaseException {
        throw unavailable();
    }

    @Override
    public Object insertOne(Document document) throws DatabaseException {
        throw unavailable();
    }

    @Override
    public Optional<Document> findOne(Document filter) throws DatabaseException {
        throw unavailable();
    }

    @Override
    public List<Document> find(Document filter, int limit) throws DatabaseException {
        throw unavailable();
    }

    @Override
    public long count(Document filter) throws DatabaseException {
        throw unavailable();
    }

    @Override
    public UpdateOutcome updateOne(Document filter, Document update, boolean upsert) throws DatabaseException {
        throw unavailable();
    }

    @Override
    public long deleteOne(Document filter) throws DatabaseException {
        throw unavailable();
    }

    @Override
    public long deleteMany(Document filter) throws DatabaseException {
        throw unavailable();
    }

    @Override
    public List<Document> listIndexes() throws DatabaseException {
        throw unavailable();
    }

    @Override
    public void createIndex(Document keys, boolean unique) throws DatabaseException {
        throw unavailable();
    }

    @Override
    public Optional<Document> validator() throws DatabaseException {
        throw unavailable();
    }

    @Override
    public void applyValidator(Document validator) throws DatabaseException {
        throw unavailable();
    }

    private DatabaseException unavailable() {
        return new DatabaseException("Collection " + name + " is unavailable: " + reason);
    }
}
