package io.mongomemory.core.db;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.CreateCollectionOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.InsertManyOptions;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.ValidationOptions;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.bson.BsonValue;
import org.bson.Document;

public final class MongoDocumentCollection implements DocumentCollection {
    private final MongoDatabase database;
    private final MongoCollection<Document> collection;
    private final String name;

    public MongoDocumentCollection(MongoDatabase database, String name) {
        this.database = database;
        this.collection = database.getCollection(name);
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int insertMany(List<Document> documents) throws DatabaseException {
        try {
            return collection.insertMany(documents, new InsertManyOptions().ordered(true)).getInsertedIds().size();
        } catch (MongoBulkWriteException e) {
            for (BulkWriteError error : e.getWriteErrors()) {
                if (ErrorCategory.fromErrorCode(error.getCode()) == ErrorCategory.DUPLICATE_KEY) {
                    throw new DuplicateKeyException(error.getMessage(), e.getWriteResult().getInsertedCount(), error.getIndex(), e);
                }
            }
            throw new DatabaseException(e.getMessage(), e);
        } catch (MongoException | IllegalArgumentException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public Object insertOne(Document document) throws DatabaseException {
        try {
            InsertOneResult result = collection.insertOne(document);
            return unwrap(result.getInsertedId());
        } catch (MongoWriteException e) {
            throw translate(e);
        } catch (MongoException | IllegalArgumentException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public Optional<Document> findOne(Document filter) throws DatabaseException {
        try {
            return Optional.ofNullable(collection.find(filter).first());
        } catch (MongoException | IllegalArgumentException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public List<Document> find(Document filter, int limit) throws DatabaseException {
        try {
            return collection.find(filter).limit(limit).into(new ArrayList<>());
        } catch (MongoException | IllegalArgumentException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public long count(Document filter) throws DatabaseException {
        try {
            return collection.countDocuments(filter);
        } catch (MongoException | IllegalArgumentException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public UpdateOutcome updateOne(Document filter, Document update, boolean upsert) throws DatabaseException {
        try {
            UpdateResult result = collection.updateOne(filter, update, new UpdateOptions().upsert(upsert));
            return new UpdateOutcome(result.getMatchedCount(), result.getModifiedCount(), unwrap(result.getUpsertedId()));
        } catch (MongoWriteException e) {
            throw translate(e);
        } catch (MongoException | IllegalArgumentException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public long deleteOne(Document filter) throws DatabaseException {
        try {
            return collection.deleteOne(filter).getDeletedCount();
        } catch (MongoException | IllegalArgumentException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public long deleteMany(Document filter) throws DatabaseException {
        try {
            return collection.deleteMany(filter).getDeletedCount();
        } catch (MongoException | IllegalArgumentException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public List<Document> listIndexes() throws DatabaseException {
        try {
            return collection.listIndexes().into(new ArrayList<>());
        } catch (MongoException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public void createIndex(Document keys, boolean unique) throws DatabaseException {
        try {
            collection.createIndex(keys, new IndexOptions().unique(unique));
        } catch (MongoException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public Optional<Document> validator() throws DatabaseException {
        try {
            Document info = database.listCollections().filter(Filters.eq("name", name)).first();
            if (info == null) {
                return Optional.empty();
            }
            Document options = info.get("options", Document.class);
            Document validator = options == null ? null : options.get("validator", Document.class);
            return validator == null || validator.isEmpty() ? Optional.empty() : Optional.of(validator);
        } catch (MongoException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public void applyValidator(Document validator) throws DatabaseException {
        try {
            boolean exists = database.listCollectionNames().into(new ArrayList<>()).contains(name);
            if (exists) {
                database.runCommand(new Document("collMod", name).append("validator", validator));
            } else {
                database.createCollection(
                    name,
                    new CreateCollectionOptions().validationOptions(new ValidationOptions().validator(validator))
                );
            }
        } catch (MongoException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    private DatabaseException translate(MongoWriteException e) {
        if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
            return new DuplicateKeyException(e.getError().getMessage(), 0, 0, e);
        }
        return new DatabaseException(e.getMessage(), e);
    }

    private static Object unwrap(BsonValue id) {
        if (id == null) {
            return null;
        }
        if (id.isObjectId()) {
            return id.asObjectId().getValue();
        }
        if (id.isString()) {
            return id.asString().getValue();
        }
        return id;
    }
}
