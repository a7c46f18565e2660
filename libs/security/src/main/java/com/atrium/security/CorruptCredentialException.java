package com.atrium.security;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;

/**
 * Thrown when a stored password hash cannot be parsed. This is damaged server-side data, not a
 * wrong password.
 */
public class CorruptCredentialException extends AtriumException {

    public CorruptCredentialException(String message) {
        super(FailureCategory.INTERNAL, message);
    }
}
