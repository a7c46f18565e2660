/**
 * Administrator authentication for the tenant engine.
 *
 * <p>{@link com.atrium.security.CredentialService} hashes passwords and issues/verifies signed
 * tokens; {@link com.atrium.security.AuthorizationGate} turns an Authorization header into
 * {@link com.atrium.security.AdminClaims}. Tokens are stateless and not revocation-aware: a
 * server-side denylist would be needed for revocation and is not provided.
 */
package com.atrium.security;
