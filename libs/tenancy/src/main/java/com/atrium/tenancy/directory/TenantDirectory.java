package com.atrium.tenancy.directory;

import com.atrium.tenancy.DuplicateAdministratorException;
import com.atrium.tenancy.DuplicateOrganizationException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative store of organization and administrator records.
 * <p>
 * Implementations only store and look up; business rules live in the provisioning engine.
 * Slug and email uniqueness must be enforced atomically by the store itself, so two racing
 * inserts cannot both succeed. Each method is a single-record operation; nothing here spans
 * records transactionally.
 */
public interface TenantDirectory {

    Optional<Organization> findOrgBySlug(String slug);

    Optional<Organization> findOrgById(String organizationId);

    Optional<Administrator> findAdminByEmail(String email);

    Optional<Administrator> findAdminById(String adminId);

    /**
     * Inserts an administrator with no organization yet.
     *
     * @throws DuplicateAdministratorException if the email is taken
     */
    Administrator insertAdministrator(String email, String passwordHash, Instant createdAt);

    /**
     * @throws DuplicateOrganizationException if the slug is taken
     */
    Organization insertOrganization(
            String name, String slug, String storageResourceName, String adminId, Instant createdAt);

    /**
     * Sets the administrator's owning organization.
     *
     * @return false if the administrator does not exist
     */
    boolean linkAdministrator(String adminId, String organizationId);

    /**
     * Rewrites the naming fields of an organization.
     *
     * @return false if the organization does not exist
     * @throws DuplicateOrganizationException if the new slug is taken
     */
    boolean updateOrganization(
            String organizationId, String name, String slug, String storageResourceName, Instant updatedAt);

    boolean deleteAdministrator(String adminId);

    boolean deleteOrganization(String organizationId);

    List<Organization> listOrganizations();

    List<Administrator> listAdministrators();
}
