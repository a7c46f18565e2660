package com.atrium.security.testing;

import com.atrium.security.AdminClaims;
import com.atrium.security.AuthorizationGate;
import com.atrium.security.CredentialService;
import com.atrium.security.SigningAlgorithm;
import com.atrium.security.TokenSettings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Builds credential components with a fixed secret and the cheapest BCrypt cost, for tests.
 * <p>
 * Lives in src/main under {@code testing} so other modules can use it from their test scope
 * through the regular dependency.
 */
public final class TestCredentialFactory {

    /** 32-byte secret, the minimum for HS256. */
    public static final String TEST_SECRET = "atrium-test-secret-0123456789abc";

    public static final int TEST_BCRYPT_STRENGTH = 4;

    private TestCredentialFactory() {
        // utility class
    }

    public static TokenSettings settings() {
        return new TokenSettings(TEST_SECRET, SigningAlgorithm.HS256, Duration.ofMinutes(60));
    }

    public static CredentialService credentialService() {
        return credentialService(Clock.systemUTC());
    }

    public static CredentialService credentialService(Clock clock) {
        return new CredentialService(settings(), TEST_BCRYPT_STRENGTH, clock);
    }

    public static AuthorizationGate gate(CredentialService credentials) {
        return new AuthorizationGate(credentials);
    }

    /**
     * Claims for an administrator of an organization, expiring an hour from now.
     */
    public static AdminClaims claims(String adminId, String organizationId) {
        return new AdminClaims(adminId, organizationId, adminId + "@atrium.test",
                Instant.now().plus(Duration.ofHours(1)));
    }
}
