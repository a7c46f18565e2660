package com.atrium.tenancy.provisioning;

/**
 * Materialized view of an organization as returned to callers.
 *
 * @param id                  organization identity
 * @param name                display name
 * @param slug                canonical slug
 * @param storageResourceName dedicated storage resource
 * @param adminEmail          owning administrator's email; empty when that record is missing
 */
public record OrganizationView(
        String id,
        String name,
        String slug,
        String storageResourceName,
        String adminEmail) {
}
