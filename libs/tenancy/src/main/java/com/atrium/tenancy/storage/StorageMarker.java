package com.atrium.tenancy.storage;

import java.time.Instant;

/**
 * Sentinel written into every freshly provisioned storage resource.
 *
 * @param schemaVersion tenant document schema version
 * @param createdAt     provisioning time
 */
public record StorageMarker(int schemaVersion, Instant createdAt) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public static final String FIELD_SCHEMA_VERSION = "schemaVersion";
    public static final String FIELD_CREATED_AT = "createdAt";

    public StorageMarker {
        if (schemaVersion < 1) {
            throw new IllegalArgumentException("schemaVersion must be positive");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt must not be null");
        }
    }

    public static StorageMarker current(Instant createdAt) {
        return new StorageMarker(CURRENT_SCHEMA_VERSION, createdAt);
    }
}
