package com.atrium.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.regex.Pattern;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * Password hashing and administrator token issuance/verification.
 * <p>
 * Passwords are hashed with BCrypt. Tokens are compact HMAC-signed JWTs carrying
 * {@code sub} (administrator ID), {@code org_id}, {@code email}, {@code iat} and {@code exp}.
 * Token verification is pure: it never touches the tenant directory.
 */
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    public static final String CLAIM_ORG_ID = "org_id";
    public static final String CLAIM_EMAIL = "email";

    /** Default BCrypt cost factor. */
    public static final int DEFAULT_BCRYPT_STRENGTH = 10;

    private static final Pattern BCRYPT_PATTERN =
            Pattern.compile("\\A\\$2(a|y|b)?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final TokenSettings settings;
    private final Clock clock;
    private final BCryptPasswordEncoder passwordEncoder;
    private final SecretKey signingKey;
    private final JwtParser parser;

    public CredentialService(TokenSettings settings, Clock clock) {
        this(settings, DEFAULT_BCRYPT_STRENGTH, clock);
    }

    /**
     * @param settings       signing secret, algorithm and default TTL
     * @param bcryptStrength BCrypt log rounds (4..31)
     * @param clock          time source for issuance and expiry checks
     */
    public CredentialService(TokenSettings settings, int bcryptStrength, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.settings = settings;
        this.clock = clock;
        this.passwordEncoder = new BCryptPasswordEncoder(bcryptStrength);
        this.signingKey = new SecretKeySpec(
                settings.secretBytes(), settings.algorithm().jcaName());
        this.parser = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    // ── Passwords ──

    /**
     * Hashes a password with a fresh random salt.
     *
     * @throws IllegalArgumentException if the password is null or empty
     */
    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password must not be null or empty");
        }
        return passwordEncoder.encode(password);
    }

    /**
     * Checks a password against a stored hash in constant time.
     *
     * @return {@code false} on mismatch (never throws for a wrong password)
     * @throws CorruptCredentialException if the stored hash is not a BCrypt hash
     */
    public boolean verify(String password, String hash) {
        if (hash == null || !BCRYPT_PATTERN.matcher(hash).matches()) {
            throw new CorruptCredentialException("stored password hash is not a valid BCrypt hash");
        }
        if (password == null) {
            return false;
        }
        return passwordEncoder.matches(password, hash);
    }

    // ── Tokens ──

    /**
     * Issues a token valid for the configured TTL.
     */
    public String issueToken(String adminId, String organizationId, String email) {
        return issueToken(adminId, organizationId, email, settings.ttl());
    }

    /**
     * Issues a token that expires at {@code now + ttl}.
     */
    public String issueToken(String adminId, String organizationId, String email, Duration ttl) {
        requireText(adminId, "adminId");
        requireText(organizationId, "organizationId");
        requireText(email, "email");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(adminId)
                .claim(CLAIM_ORG_ID, organizationId)
                .claim(CLAIM_EMAIL, email)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(signingKey, settings.algorithm().macAlgorithm())
                .compact();
    }

    /**
     * Verifies signature, algorithm and expiry and returns the embedded claims verbatim.
     *
     * @throws TokenExpiredException if the current time is strictly after the token's expiry
     * @throws TokenInvalidException on a bad signature, malformed structure, unexpected
     *                               algorithm or missing claims
     */
    public AdminClaims verifyToken(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException("token is empty");
        }
        try {
            Jws<Claims> jws = parser.parseSignedClaims(token);
            String algorithm = jws.getHeader().getAlgorithm();
            if (!settings.algorithm().headerName().equals(algorithm)) {
                throw new TokenInvalidException("unexpected signing algorithm " + algorithm);
            }
            Claims claims = jws.getPayload();
            String adminId = claims.getSubject();
            String organizationId = claims.get(CLAIM_ORG_ID, String.class);
            String email = claims.get(CLAIM_EMAIL, String.class);
            Date expiration = claims.getExpiration();
            if (isBlank(adminId) || isBlank(organizationId) || isBlank(email) || expiration == null) {
                throw new TokenInvalidException("token is missing required claims");
            }
            return new AdminClaims(adminId, organizationId, email, expiration.toInstant());
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired token for subject {}", e.getClaims().getSubject());
            throw new TokenExpiredException(e.getClaims().getExpiration().toInstant(), e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected invalid token: {}", e.getMessage());
            throw new TokenInvalidException("token could not be verified", e);
        }
    }

    public TokenSettings settings() {
        return settings;
    }

    private static void requireText(String value, String name) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
