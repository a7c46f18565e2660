package com.atrium.tenancy;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.util.Map;

/**
 * Thrown when reclaiming a storage resource that a live organization still references.
 */
public class StorageResourceInUseException extends AtriumException {

    public StorageResourceInUseException(String resourceName, String slug) {
        super(FailureCategory.CONFLICT,
                "Storage resource '%s' is in use by organization '%s'".formatted(resourceName, slug),
                Map.of("storageResource", resourceName, "slug", slug));
    }
}
