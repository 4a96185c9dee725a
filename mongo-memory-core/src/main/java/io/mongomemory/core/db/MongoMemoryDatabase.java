package io.mongomemory.core.db;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.mongomemory.core.config.MemoryStoreConfig;
import java.util.concurrent.TimeUnit;
import org.bson.Document;

public final class MongoMemoryDatabase implements MemoryDatabase {
    private final MongoClient client;

    public MongoMemoryDatabase(MongoClient client) {
        this.client = client;
    }

    public static MongoMemoryDatabase connect(MemoryStoreConfig config) throws DatabaseException {
        try {
            long timeoutMillis = config.serverSelectionTimeout().toMillis();
            MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(config.connectionString()))
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(timeoutMillis, TimeUnit.MILLISECONDS))
                .build();
            return new MongoMemoryDatabase(MongoClients.create(settings));
        } catch (IllegalArgumentException | MongoException e) {
            throw new DatabaseException("Failed to create MongoDB client: " + e.getMessage(), e);
        }
    }

    @Override
    public void ping() throws DatabaseException {
        try {
            client.getDatabase("admin").runCommand(new Document("ping", 1));
        } catch (MongoException e) {
            throw new DatabaseException("MongoDB ping failed: " + e.getMessage(), e);
        }
    }

    @Override
    public DocumentCollection collection(String database, String collection) {
        return new MongoDocumentCollection(client.getDatabase(database), collection);
    }

    @Override
    public void close() {
        client.close();
    }
}
