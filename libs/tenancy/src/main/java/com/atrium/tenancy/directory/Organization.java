package com.atrium.tenancy.directory;

import java.time.Instant;

/**
 * Directory record of a live organization.
 *
 * @param id                  organization identity
 * @param name                display name as last supplied
 * @param slug                canonical, unique identifier derived from {@code name}
 * @param storageResourceName dedicated storage resource, always {@code tenant_<slug>}
 * @param adminId             owning administrator
 * @param createdAt           creation time
 * @param updatedAt           last rename (equals {@code createdAt} until then)
 */
public record Organization(
        String id,
        String name,
        String slug,
        String storageResourceName,
        String adminId,
        Instant createdAt,
        Instant updatedAt) {
}
