package com.atrium.tenancy.directory;

import java.time.Instant;

/**
 * Directory record of an organization's administrator.
 *
 * @param id             administrator identity
 * @param email          unique login email, immutable after creation
 * @param passwordHash   BCrypt hash supplied by the caller
 * @param organizationId owned organization; null until back-linked at the end of a create
 * @param createdAt      creation time
 */
public record Administrator(
        String id,
        String email,
        String passwordHash,
        String organizationId,
        Instant createdAt) {

    public Administrator withOrganization(String organizationId) {
        return new Administrator(id, email, passwordHash, organizationId, createdAt);
    }

    @Override
    public String toString() {
        return "Administrator[id=" + id + ", email=" + email + ", passwordHash=[REDACTED], organizationId="
                + organizationId + ", createdAt=" + createdAt + "]";
    }
}
