package com.atrium.security;

import java.time.Instant;

/**
 * Verified payload of an administrator token: the authenticated principal.
 * <p>
 * Tokens are not revocation-aware. Callers must re-check that {@code adminId} and
 * {@code organizationId} still exist before acting on them.
 *
 * @param adminId        administrator identity (JWT {@code sub})
 * @param organizationId organization the administrator owned at issuance (JWT {@code org_id})
 * @param email          administrator email at issuance (JWT {@code email})
 * @param expiresAt      absolute expiry (JWT {@code exp}, second precision)
 */
public record AdminClaims(String adminId, String organizationId, String email, Instant expiresAt) {
}
