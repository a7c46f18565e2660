package com.atrium.tenantservice.domain;

import jakarta.validation.constraints.NotBlank;

/**
 * @param organizationName display name of the organization to delete; must resolve to the
 *                         caller's own organization
 */
public record DeleteOrganizationCommand(@NotBlank String organizationName) {
}
