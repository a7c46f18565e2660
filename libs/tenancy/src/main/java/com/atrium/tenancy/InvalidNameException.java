package com.atrium.tenancy;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.util.Map;

/**
 * Thrown when an organization name does not normalize to a usable slug.
 */
public class InvalidNameException extends AtriumException {

    public InvalidNameException(String name) {
        super(FailureCategory.INVALID_INPUT, "Invalid organization name: '%s'".formatted(name),
                Map.of("name", String.valueOf(name)));
    }
}
