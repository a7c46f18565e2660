package com.atrium.tenancy;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.util.Map;

public class OrganizationNotFoundException extends AtriumException {

    public OrganizationNotFoundException(String key, String value) {
        super(FailureCategory.NOT_FOUND, "Organization not found: %s=%s".formatted(key, value),
                Map.of(key, String.valueOf(value)));
    }

    public static OrganizationNotFoundException bySlug(String slug) {
        return new OrganizationNotFoundException("slug", slug);
    }

    public static OrganizationNotFoundException byId(String organizationId) {
        return new OrganizationNotFoundException("organizationId", organizationId);
    }
}
