package com.atrium.tenancy.testing;

import com.atrium.tenancy.StorageResourceExistsException;
import com.atrium.tenancy.TenantOperationInterruptedException;
import com.atrium.tenancy.naming.StorageResourceNames;
import com.atrium.tenancy.storage.StorageMarker;
import com.atrium.tenancy.storage.TenantStorage;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Map-backed tenant storage for tests and the {@code in-memory} service backend.
 * <p>
 * Document identities are random UUIDs stored under {@link #IDENTITY_FIELD}. A copy takes a
 * snapshot of the source first, then writes one document at a time without holding the lock,
 * so concurrent writers can interleave the way they would against a real store.
 */
public class InMemoryTenantStorage implements TenantStorage {

    private final Map<String, List<Map<String, Object>>> resources = new HashMap<>();

    @Override
    public void provision(String resourceName, StorageMarker marker) {
        create(resourceName);
        Map<String, Object> sentinel = new LinkedHashMap<>();
        sentinel.put(StorageMarker.FIELD_SCHEMA_VERSION, marker.schemaVersion());
        sentinel.put(StorageMarker.FIELD_CREATED_AT, marker.createdAt());
        insertDocument(resourceName, sentinel);
    }

    @Override
    public synchronized boolean exists(String resourceName) {
        return resources.containsKey(resourceName);
    }

    @Override
    public long copyDocuments(String source, String target) {
        List<Map<String, Object>> snapshot = documents(source);
        create(target);
        long copied = 0;
        for (Map<String, Object> document : snapshot) {
            if (Thread.currentThread().isInterrupted()) {
                throw new TenantOperationInterruptedException(source, target, copied);
            }
            insertDocument(target, document);
            copied++;
        }
        return copied;
    }

    @Override
    public synchronized void destroy(String resourceName) {
        resources.remove(resourceName);
    }

    @Override
    public synchronized List<String> listResources() {
        return resources.keySet().stream()
                .filter(StorageResourceNames::isTenantResource)
                .sorted()
                .toList();
    }

    /** Inserts into the resource, creating it implicitly the way a document store does. */
    @Override
    public synchronized void insertDocument(String resourceName, Map<String, Object> document) {
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put(IDENTITY_FIELD, UUID.randomUUID().toString());
        document.forEach((key, value) -> {
            if (!IDENTITY_FIELD.equals(key)) {
                stored.put(key, value);
            }
        });
        resources.computeIfAbsent(resourceName, name -> new ArrayList<>()).add(stored);
    }

    @Override
    public synchronized List<Map<String, Object>> documents(String resourceName) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> stored : resources.getOrDefault(resourceName, List.of())) {
            Map<String, Object> content = new LinkedHashMap<>(stored);
            content.remove(IDENTITY_FIELD);
            result.add(content);
        }
        return result;
    }

    @Override
    public synchronized long countDocuments(String resourceName) {
        return resources.getOrDefault(resourceName, List.of()).size();
    }

    /** Stored documents including their identity, for assertions on identity regeneration. */
    public synchronized List<Map<String, Object>> rawDocuments(String resourceName) {
        return resources.getOrDefault(resourceName, List.of()).stream()
                .<Map<String, Object>>map(LinkedHashMap::new)
                .toList();
    }

    private synchronized void create(String resourceName) {
        if (resources.putIfAbsent(resourceName, new ArrayList<>()) != null) {
            throw new StorageResourceExistsException(resourceName, null);
        }
    }
}
