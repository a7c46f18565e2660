package com.atrium.security;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;

/**
 * Thrown when a request carries no usable {@code Authorization: Bearer <token>} header.
 */
public class MissingCredentialsException extends AtriumException {

    public MissingCredentialsException() {
        super(FailureCategory.AUTHENTICATION, "Missing or invalid Authorization header");
    }
}
