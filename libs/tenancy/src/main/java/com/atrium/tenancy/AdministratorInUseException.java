package com.atrium.tenancy;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.util.Map;

/**
 * Thrown when reclaiming an administrator that still owns a live organization.
 */
public class AdministratorInUseException extends AtriumException {

    public AdministratorInUseException(String adminId, String slug) {
        super(FailureCategory.CONFLICT,
                "Administrator '%s' owns organization '%s'".formatted(adminId, slug),
                Map.of("adminId", adminId, "slug", slug));
    }
}
