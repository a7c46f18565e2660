package com.atrium.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from Authorization header values.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the token from {@code "Bearer <token>"}.
     * <p>
     * The scheme is matched case-insensitively and must be followed by whitespace;
     * {@code "Bearerxyz"} is not a bearer header.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token, or empty if the header is missing or malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals(SCHEME)
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(SCHEME.length()).strip();
        if (token.isEmpty() || token.chars().anyMatch(Character::isWhitespace)) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
