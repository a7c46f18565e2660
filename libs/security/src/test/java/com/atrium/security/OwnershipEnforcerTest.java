package com.atrium.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atrium.common.FailureCategory;
import com.atrium.security.testing.TestCredentialFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OwnershipEnforcer")
class OwnershipEnforcerTest {

    private final AdminClaims claims = TestCredentialFactory.claims("admin-1", "org-1");

    @Nested
    @DisplayName("requireAdministrator()")
    class RequireAdministrator {

        @Test
        @DisplayName("passes for the token subject")
        void matches() {
            assertThatCode(() -> OwnershipEnforcer.requireAdministrator(claims, "admin-1"))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("throws NotAuthorizedException for another administrator")
        void mismatch() {
            assertThatThrownBy(() -> OwnershipEnforcer.requireAdministrator(claims, "admin-2"))
                    .isInstanceOf(NotAuthorizedException.class)
                    .hasMessageContaining("admin-1")
                    .hasMessageContaining("admin-2");
        }
    }

    @Nested
    @DisplayName("requireOrganization()")
    class RequireOrganization {

        @Test
        @DisplayName("passes for the token organization")
        void matches() {
            assertThatCode(() -> OwnershipEnforcer.requireOrganization(claims, "org-1"))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("exception carries both organization IDs and AUTHORIZATION category")
        void mismatch() {
            try {
                OwnershipEnforcer.requireOrganization(claims, "org-2");
            } catch (NotAuthorizedException e) {
                assertThat(e.category()).isEqualTo(FailureCategory.AUTHORIZATION);
                assertThat(e.context())
                        .containsEntry("tokenOrganizationId", "org-1")
                        .containsEntry("targetOrganizationId", "org-2");
                return;
            }
            throw new AssertionError("Expected NotAuthorizedException");
        }
    }
}
