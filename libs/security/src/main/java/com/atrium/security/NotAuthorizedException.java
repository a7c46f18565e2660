package com.atrium.security;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.util.Map;

/**
 * Thrown when an authenticated administrator acts on something it does not own.
 */
public class NotAuthorizedException extends AtriumException {

    public NotAuthorizedException(String message, Map<String, String> context) {
        super(FailureCategory.AUTHORIZATION, message, context);
    }

    public static NotAuthorizedException adminMismatch(String requesterAdminId, String ownerAdminId) {
        return new NotAuthorizedException(
                "Administrator '%s' is not authorized to act for administrator '%s'"
                        .formatted(requesterAdminId, ownerAdminId),
                Map.of("requesterAdminId", String.valueOf(requesterAdminId),
                        "ownerAdminId", String.valueOf(ownerAdminId)));
    }

    public static NotAuthorizedException organizationMismatch(
            String tokenOrganizationId, String targetOrganizationId) {
        return new NotAuthorizedException(
                "Token for organization '%s' cannot act on organization '%s'"
                        .formatted(tokenOrganizationId, targetOrganizationId),
                Map.of("tokenOrganizationId", String.valueOf(tokenOrganizationId),
                        "targetOrganizationId", String.valueOf(targetOrganizationId)));
    }
}
