package com.atrium.security;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.time.Instant;
import java.util.Map;

/**
 * Thrown when the current time is strictly after a token's embedded expiry.
 */
public class TokenExpiredException extends AtriumException {

    private final Instant expiredAt;

    public TokenExpiredException(Instant expiredAt, Throwable cause) {
        super(FailureCategory.AUTHENTICATION, "Token expired at " + expiredAt,
                Map.of("expiredAt", String.valueOf(expiredAt)), cause);
        this.expiredAt = expiredAt;
    }

    public Instant expiredAt() {
        return expiredAt;
    }
}
