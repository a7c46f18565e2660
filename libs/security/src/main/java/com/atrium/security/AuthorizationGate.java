package com.atrium.security;

/**
 * Authenticates inbound administrative requests from their Authorization header.
 * <p>
 * The resulting {@link AdminClaims} are the principal for the caller's own authorization
 * decisions, e.g. comparing {@link AdminClaims#organizationId()} with the organization being
 * mutated (see {@link OwnershipEnforcer}).
 */
public class AuthorizationGate {

    private final CredentialService credentials;

    public AuthorizationGate(CredentialService credentials) {
        if (credentials == null) {
            throw new IllegalArgumentException("credentials must not be null");
        }
        this.credentials = credentials;
    }

    /**
     * @param rawHeaderValue the raw Authorization header value (may be null)
     * @throws MissingCredentialsException if the header is absent or not a bearer header
     * @throws TokenInvalidException       if the token fails verification
     * @throws TokenExpiredException       if the token has expired
     */
    public AdminClaims authenticate(String rawHeaderValue) {
        String token = BearerTokenExtractor.extract(rawHeaderValue)
                .orElseThrow(MissingCredentialsException::new);
        return credentials.verifyToken(token);
    }
}
