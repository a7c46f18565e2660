package com.atrium.tenancy;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.util.Map;

/**
 * Thrown when an administrator email is already registered.
 */
public class DuplicateAdministratorException extends AtriumException {

    public DuplicateAdministratorException(String email) {
        this(email, null);
    }

    public DuplicateAdministratorException(String email, Throwable cause) {
        super(FailureCategory.CONFLICT, "Administrator '%s' already exists".formatted(email),
                Map.of("email", String.valueOf(email)), cause);
    }
}
