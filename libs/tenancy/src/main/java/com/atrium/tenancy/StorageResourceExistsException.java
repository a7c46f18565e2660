package com.atrium.tenancy;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.util.Map;

/**
 * Thrown when a storage resource is about to be created but already exists, usually one
 * retained by an earlier rename or left by an interrupted operation. It must be reclaimed
 * explicitly before the name can be reused.
 */
public class StorageResourceExistsException extends AtriumException {

    public StorageResourceExistsException(String resourceName, Throwable cause) {
        super(FailureCategory.CONFLICT,
                ("Storage resource '%s' already exists; reclaim it with TenantReconciler.reclaimStorage "
                        + "before reusing the name").formatted(resourceName),
                Map.of("storageResource", String.valueOf(resourceName)), cause);
    }
}
