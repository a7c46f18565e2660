package com.atrium.tenancy;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.util.Map;

/**
 * Thrown when a create or rename targets a slug another organization already uses. Names that
 * normalize identically collide regardless of casing or punctuation. A slug whose storage
 * resource already exists is taken as well, whether a concurrent create holds it or a rename
 * left it behind; the cause is then a {@link StorageResourceExistsException}.
 */
public class DuplicateOrganizationException extends AtriumException {

    private final String slug;

    public DuplicateOrganizationException(String slug) {
        this(slug, null);
    }

    public DuplicateOrganizationException(String slug, Throwable cause) {
        super(FailureCategory.CONFLICT, "Organization '%s' already exists".formatted(slug),
                Map.of("slug", String.valueOf(slug)), cause);
        this.slug = slug;
    }

    /**
     * The slug's storage resource exists although the directory had no organization for it.
     */
    public static DuplicateOrganizationException storageTaken(
            String slug, String resourceName, StorageResourceExistsException cause) {
        return new DuplicateOrganizationException(slug,
                ("Organization '%s' is unavailable: storage resource '%s' already exists; "
                        + "if no organization owns it, reclaim it with TenantReconciler.reclaimStorage")
                        .formatted(slug, resourceName),
                Map.of("slug", String.valueOf(slug), "storageResource", String.valueOf(resourceName)),
                cause);
    }

    private DuplicateOrganizationException(
            String slug, String message, Map<String, String> context, Throwable cause) {
        super(FailureCategory.CONFLICT, message, context, cause);
        this.slug = slug;
    }

    public String slug() {
        return slug;
    }
}
