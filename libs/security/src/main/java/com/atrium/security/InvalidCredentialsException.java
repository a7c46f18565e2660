package com.atrium.security;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;

/**
 * Thrown when an email/password pair does not identify an administrator. The message is the
 * same whether the email is unknown or the password is wrong.
 */
public class InvalidCredentialsException extends AtriumException {

    public InvalidCredentialsException() {
        super(FailureCategory.AUTHENTICATION, "Invalid admin credentials");
    }
}
