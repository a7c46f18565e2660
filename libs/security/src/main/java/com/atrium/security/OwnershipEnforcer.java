package com.atrium.security;

/**
 * Compares an authenticated principal against the administrator or organization a request
 * targets. Identity comparison is plain string equality.
 */
public final class OwnershipEnforcer {

    private OwnershipEnforcer() {
        // utility class
    }

    /**
     * @throws NotAuthorizedException if the token subject is not {@code adminId}
     */
    public static void requireAdministrator(AdminClaims claims, String adminId) {
        if (!claims.adminId().equals(adminId)) {
            throw NotAuthorizedException.adminMismatch(claims.adminId(), adminId);
        }
    }

    /**
     * @throws NotAuthorizedException if the token was not issued for {@code organizationId}
     */
    public static void requireOrganization(AdminClaims claims, String organizationId) {
        if (!claims.organizationId().equals(organizationId)) {
            throw NotAuthorizedException.organizationMismatch(claims.organizationId(), organizationId);
        }
    }
}
