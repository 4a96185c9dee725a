package io.mongomemory.core.db;

import java.util.List;
import java.util.Optional;
import org.bson.Document;

public interface DocumentCollection {
    String name();

    /**
     * Inserts the documents in order and stops at the first rejected one.
     *
     * @return number of inserted documents
     * @throws DuplicateKeyException when a unique index rejects a document
     */
    int insertMany(List<Document> documents) throws DatabaseException;

    Object insertOne(Document document) throws DatabaseException;

    Optional<Document> findOne(Document filter) throws DatabaseException;

    List<Document> find(Document filter, int limit) throws DatabaseException;

    long count(Document filter) throws DatabaseException;

    UpdateOutcome updateOne(Document filter, Document update, boolean upsert) throws DatabaseException;

    long deleteOne(Document filter) throws DatabaseException;

    long deleteMany(Document filter) throws DatabaseException;

    List<Document> listIndexes() throws DatabaseException;

    void createIndex(Document keys, boolean unique) throws DatabaseException;

    Optional<Document> validator() throws DatabaseException;

    void applyValidator(Document validator) throws DatabaseException;
}
