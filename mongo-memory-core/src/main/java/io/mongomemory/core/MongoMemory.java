package io.mongomemory.core;

import io.mongomemory.core.config.ConfigurationGate;
import io.mongomemory.core.config.MemoryStoreConfig;
import io.mongomemory.core.db.DatabaseConnector;
import io.mongomemory.core.db.DatabaseException;
import io.mongomemory.core.db.DisabledDocumentCollection;
import io.mongomemory.core.db.DocumentCollection;
import io.mongomemory.core.db.MemoryDatabase;
import io.mongomemory.core.db.MongoMemoryDatabase;
import io.mongomemory.core.entity.EntityStore;
import io.mongomemory.core.envelope.ErrorKind;
import io.mongomemory.core.envelope.StoreResult;
import io.mongomemory.core.relationship.RelationshipStore;
import io.mongomemory.core.schema.SchemaBootstrapper;
import io.mongomemory.core.structure.MemoryStructureService;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MongoMemory implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MongoMemory.class);

    static final String NOT_CONFIGURED = "No " + MemoryStoreConfig.CONNECTION_ENV + " set for MongoDB";
    static final String CANNOT_CONNECT = "Can't connect to MongoDB";

    private final MemoryStoreConfig config;
    private final MemoryDatabase database;
    private final ConfigurationGate gate;
    private final SchemaBootstrapper bootstrapper;
    private final EntityStore entities;
    private final RelationshipStore relationships;
    private final MemoryStructureService structure;

    private MongoMemory(
        MemoryStoreConfig config,
        MemoryDatabase database,
        ConfigurationGate gate,
        DocumentCollection entityCollection,
        DocumentCollection relationshipCollection,
        DocumentCollection systemCollection,
        Clock clock
    ) {
        this.config = config;
        this.database = database;
        this.gate = gate;
        this.bootstrapper = new SchemaBootstrapper(entityCollection, relationshipCollection);
        this.entities = new EntityStore(entityCollection, relationshipCollection, gate, clock, config.orphanPolicy());
        this.relationships = new RelationshipStore(relationshipCollection, entities, bootstrapper, gate, clock);
        this.structure = new MemoryStructureService(systemCollection, entityCollection, gate, config.structureSampleSize());
    }

    public static MongoMemory open(MemoryStoreConfig config) {
        return open(config, MongoMemoryDatabase::connect, Clock.systemUTC());
    }

    public static MongoMemory open(MemoryStoreConfig config, DatabaseConnector connector, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(connector, "connector must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        if (!config.configured()) {
            log.warn("{} is not set; memory operations will report a configuration error", MemoryStoreConfig.CONNECTION_ENV);
            return disabled(config, clock, StoreResult.error(
                ErrorKind.CONFIGURATION,
                NOT_CONFIGURED,
                "Set " + MemoryStoreConfig.CONNECTION_ENV + " to a MongoDB connection string"
            ));
        }

        MemoryDatabase database = null;
        try {
            database = connector.connect(config);
            database.ping();
        } catch (DatabaseException e) {
            log.warn("Could not reach MongoDB: {}", e.getMessage());
            if (database != null) {
                database.close();
            }
            return disabled(config, clock, StoreResult.error(ErrorKind.CONFIGURATION, CANNOT_CONNECT, e.getMessage()));
        }

        MongoMemory memory = new MongoMemory(
            config,
            database,
            ConfigurationGate.open(),
            database.collection(config.database(), config.entityCollection()),
            database.collection(config.database(), config.relationshipCollection()),
            database.collection(config.systemDatabase(), config.systemCollection()),
            clock
        );
        try {
            memory.bootstrapper.bootstrapEntities();
        } catch (DatabaseException e) {
            database.close();
            throw new IllegalStateException("Failed to bootstrap the entity collection: " + e.getMessage(), e);
        }
        log.info("Connected to MongoDB database {} (orphan policy {})", config.database(), config.orphanPolicy());
        return memory;
    }

    private static MongoMemory disabled(MemoryStoreConfig config, Clock clock, StoreResult failure) {
        String reason = failure.message();
        return new MongoMemory(
            config,
            null,
            ConfigurationGate.closed(failure),
            new DisabledDocumentCollection(config.entityCollection(), reason),
            new DisabledDocumentCollection(config.relationshipCollection(), reason),
            new DisabledDocumentCollection(config.systemCollection(), reason),
            clock
        );
    }

    public EntityStore entities() {
        return entities;
    }

    public RelationshipStore relationships() {
        return relationships;
    }

    public MemoryStructureService structure() {
        return structure;
    }

    public ConfigurationGate gate() {
        return gate;
    }

    public MemoryStoreConfig config() {
        return config;
    }

    @Override
    public void close() {
        if (database != null) {
            database.close();
        }
    }
}
