package com.atrium.tenancy.naming;

/**
 * Naming of per-tenant storage resources: always {@code tenant_<slug>}.
 */
public final class StorageResourceNames {

    public static final String PREFIX = "tenant_";

    private StorageResourceNames() {
        // utility class
    }

    public static String forSlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug must not be null or blank");
        }
        return PREFIX + slug;
    }

    /**
     * Whether {@code name} is a tenant storage resource rather than a directory collection.
     */
    public static boolean isTenantResource(String name) {
        return name != null && name.startsWith(PREFIX) && name.length() > PREFIX.length();
    }
}
