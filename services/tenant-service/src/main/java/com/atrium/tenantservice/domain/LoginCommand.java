package com.atrium.tenantservice.domain;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record LoginCommand(@NotBlank @Email String email, @NotBlank String password) {

    @Override
    public String toString() {
        return "LoginCommand[email=" + email + ", password=[REDACTED]]";
    }
}
