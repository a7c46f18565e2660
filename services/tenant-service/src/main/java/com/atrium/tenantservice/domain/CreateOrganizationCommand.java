package com.atrium.tenantservice.domain;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Registers an organization together with its administrator.
 */
public record CreateOrganizationCommand(
        @NotBlank @Size(min = 3, max = 50) String organizationName,
        @NotBlank @Email String email,
        @NotBlank @Size(min = 8) String password) {

    @Override
    public String toString() {
        return "CreateOrganizationCommand[organizationName=" + organizationName + ", email=" + email
                + ", password=[REDACTED]]";
    }
}
