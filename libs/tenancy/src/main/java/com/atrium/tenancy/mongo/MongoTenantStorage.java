package com.atrium.tenancy.mongo;

import com.atrium.tenancy.StorageResourceExistsException;
import com.atrium.tenancy.TenantOperationInterruptedException;
import com.atrium.tenancy.naming.StorageResourceNames;
import com.atrium.tenancy.storage.StorageMarker;
import com.atrium.tenancy.storage.TenantStorage;
import com.mongodb.MongoCommandException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tenant storage as one MongoDB collection per organization, in the master database.
 */
public class MongoTenantStorage implements TenantStorage {

    private static final Logger log = LoggerFactory.getLogger(MongoTenantStorage.class);

    private final MongoDatabase database;

    public MongoTenantStorage(MongoDatabase database) {
        if (database == null) {
            throw new IllegalArgumentException("database must not be null");
        }
        this.database = database;
    }

    @Override
    public void provision(String resourceName, StorageMarker marker) {
        create(resourceName);
        database.getCollection(resourceName).insertOne(new Document()
                .append(StorageMarker.FIELD_SCHEMA_VERSION, marker.schemaVersion())
                .append(StorageMarker.FIELD_CREATED_AT, Date.from(marker.createdAt())));
    }

    @Override
    public boolean exists(String resourceName) {
        return database.listCollections()
                .filter(Filters.eq("name", resourceName))
                .first() != null;
    }

    @Override
    public long copyDocuments(String source, String target) {
        create(target);
        MongoCollection<Document> to = database.getCollection(target);
        long copied = 0;
        try (MongoCursor<Document> cursor = database.getCollection(source).find()
                .sort(Sorts.ascending(IDENTITY_FIELD))
                .iterator()) {
            while (cursor.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Copy {} -> {} interrupted after {} documents", source, target, copied);
                    throw new TenantOperationInterruptedException(source, target, copied);
                }
                Document document = cursor.next();
                document.remove(IDENTITY_FIELD);
                to.insertOne(document);
                copied++;
            }
        }
        return copied;
    }

    @Override
    public void destroy(String resourceName) {
        database.getCollection(resourceName).drop();
    }

    @Override
    public List<String> listResources() {
        List<String> names = new ArrayList<>();
        for (String name : database.listCollectionNames()) {
            if (StorageResourceNames.isTenantResource(name)) {
                names.add(name);
            }
        }
        names.sort(null);
        return names;
    }

    @Override
    public void insertDocument(String resourceName, Map<String, Object> document) {
        Document copy = new Document(document);
        copy.remove(IDENTITY_FIELD);
        database.getCollection(resourceName).insertOne(copy);
    }

    @Override
    public List<Map<String, Object>> documents(String resourceName) {
        List<Map<String, Object>> result = new ArrayList<>();
        try (MongoCursor<Document> cursor = database.getCollection(resourceName).find()
                .sort(Sorts.ascending(IDENTITY_FIELD))
                .iterator()) {
            while (cursor.hasNext()) {
                Map<String, Object> content = new LinkedHashMap<>(cursor.next());
                content.remove(IDENTITY_FIELD);
                result.add(content);
            }
        }
        return result;
    }

    @Override
    public long countDocuments(String resourceName) {
        return database.getCollection(resourceName).countDocuments();
    }

    private void create(String resourceName) {
        try {
            database.createCollection(resourceName);
        } catch (MongoCommandException e) {
            if (MongoErrors.isNamespaceExists(e)) {
                throw new StorageResourceExistsException(resourceName, e);
            }
            throw e;
        }
    }
}
