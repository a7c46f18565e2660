package com.atrium.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Process-wide token configuration, loaded once at startup and never mutated.
 *
 * @param secret    shared HMAC secret (UTF-8 bytes are the key)
 * @param algorithm signing algorithm; defaults to {@link SigningAlgorithm#HS256}
 * @param ttl       lifetime of issued tokens; defaults to 60 minutes
 */
public record TokenSettings(String secret, SigningAlgorithm algorithm, Duration ttl) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(60);

    public TokenSettings {
        if (algorithm == null) {
            algorithm = SigningAlgorithm.HS256;
        }
        if (ttl == null) {
            ttl = DEFAULT_TTL;
        }
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be null or blank");
        }
        int length = secret.getBytes(StandardCharsets.UTF_8).length;
        if (length < algorithm.minimumSecretBytes()) {
            throw new IllegalArgumentException("secret for %s must be at least %d bytes, got %d"
                    .formatted(algorithm, algorithm.minimumSecretBytes(), length));
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    byte[] secretBytes() {
        return secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "TokenSettings[secret=[REDACTED], algorithm=" + algorithm + ", ttl=" + ttl + "]";
    }
}
