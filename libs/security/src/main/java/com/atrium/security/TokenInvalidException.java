package com.atrium.security;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.util.Map;

/**
 * Thrown when a token has a bad signature, a malformed structure, an unexpected algorithm or
 * missing claims.
 */
public class TokenInvalidException extends AtriumException {

    public TokenInvalidException(String message) {
        super(FailureCategory.AUTHENTICATION, message);
    }

    public TokenInvalidException(String message, Throwable cause) {
        super(FailureCategory.AUTHENTICATION, message, Map.of(), cause);
    }
}
