package com.atrium.tenancy.provisioning;

import java.time.Instant;
import java.util.List;

/**
 * Partial-failure leftovers found by {@link TenantReconciler#audit()}.
 * <p>
 * A create or rename in flight while the audit runs shows up here transiently; act on an
 * entry only if it persists across audits.
 *
 * @param orphanedStorageResources       tenant resources no organization references, including
 *                                       resources retained by renames
 * @param orphanedAdministratorIds       administrators owning no organization
 * @param unlinkedAdministratorIds       administrators owning an organization whose back-link is
 *                                       missing or wrong
 * @param organizationsMissingStorage    slugs whose storage resource does not exist
 * @param organizationsMissingAdministrator slugs whose administrator record does not exist
 * @param auditedAt                      when the audit ran
 */
public record ReconciliationReport(
        List<String> orphanedStorageResources,
        List<String> orphanedAdministratorIds,
        List<String> unlinkedAdministratorIds,
        List<String> organizationsMissingStorage,
        List<String> organizationsMissingAdministrator,
        Instant auditedAt) {

    public ReconciliationReport {
        orphanedStorageResources = List.copyOf(orphanedStorageResources);
        orphanedAdministratorIds = List.copyOf(orphanedAdministratorIds);
        unlinkedAdministratorIds = List.copyOf(unlinkedAdministratorIds);
        organizationsMissingStorage = List.copyOf(organizationsMissingStorage);
        organizationsMissingAdministrator = List.copyOf(organizationsMissingAdministrator);
    }

    public boolean isConsistent() {
        return orphanedStorageResources.isEmpty()
                && orphanedAdministratorIds.isEmpty()
                && unlinkedAdministratorIds.isEmpty()
                && organizationsMissingStorage.isEmpty()
                && organizationsMissingAdministrator.isEmpty();
    }
}
