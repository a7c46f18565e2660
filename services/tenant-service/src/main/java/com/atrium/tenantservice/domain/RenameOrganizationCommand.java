package com.atrium.tenantservice.domain;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Renames the caller's organization. The administrator re-enters credentials even though the
 * request already carries a token.
 *
 * @param organizationName the new display name
 */
public record RenameOrganizationCommand(
        @NotBlank @Size(min = 3, max = 50) String organizationName,
        @NotBlank @Email String email,
        @NotBlank String password) {

    @Override
    public String toString() {
        return "RenameOrganizationCommand[organizationName=" + organizationName + ", email=" + email
                + ", password=[REDACTED]]";
    }
}
