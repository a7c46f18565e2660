package com.atrium.tenancy.provisioning;

import com.atrium.tenancy.AdministratorInUseException;
import com.atrium.tenancy.StorageResourceInUseException;
import com.atrium.tenancy.directory.Administrator;
import com.atrium.tenancy.directory.Organization;
import com.atrium.tenancy.directory.TenantDirectory;
import com.atrium.tenancy.naming.StorageResourceNames;
import com.atrium.tenancy.storage.TenantStorage;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects and cleans up what non-atomic lifecycle operations leave behind.
 * <p>
 * The engine never rolls back, so a crash mid-create can orphan a storage resource or an
 * administrator, a crash mid-rename can orphan a partial copy, a crash mid-delete can orphan
 * directory records, and every successful rename retains the previous storage resource. This
 * class makes those states visible and offers explicit, guarded cleanup.
 */
public class TenantReconciler {

    private static final Logger log = LoggerFactory.getLogger(TenantReconciler.class);

    private final TenantDirectory directory;
    private final TenantStorage storage;
    private final Clock clock;

    public TenantReconciler(TenantDirectory directory, TenantStorage storage, Clock clock) {
        if (directory == null || storage == null || clock == null) {
            throw new IllegalArgumentException("directory, storage and clock must not be null");
        }
        this.directory = directory;
        this.storage = storage;
        this.clock = clock;
    }

    public ReconciliationReport audit() {
        List<Organization> organizations = directory.listOrganizations();
        List<Administrator> administrators = directory.listAdministrators();
        List<String> resources = storage.listResources();

        Set<String> referencedResources = organizations.stream()
                .map(Organization::storageResourceName)
                .collect(Collectors.toSet());
        Map<String, Organization> organizationsByAdmin = organizations.stream()
                .collect(Collectors.toMap(Organization::adminId, Function.identity(), (a, b) -> a));
        Set<String> adminIds = administrators.stream()
                .map(Administrator::id)
                .collect(Collectors.toSet());
        Set<String> existingResources = new HashSet<>(resources);

        List<String> orphanedResources = resources.stream()
                .filter(r -> !referencedResources.contains(r))
                .toList();

        List<String> orphanedAdmins = new ArrayList<>();
        List<String> unlinkedAdmins = new ArrayList<>();
        for (Administrator admin : administrators) {
            Organization owned = organizationsByAdmin.get(admin.id());
            if (owned == null) {
                orphanedAdmins.add(admin.id());
            } else if (!Objects.equals(owned.id(), admin.organizationId())) {
                unlinkedAdmins.add(admin.id());
            }
        }

        List<String> missingStorage = organizations.stream()
                .filter(o -> !existingResources.contains(o.storageResourceName()))
                .map(Organization::slug)
                .toList();
        List<String> missingAdmin = organizations.stream()
                .filter(o -> !adminIds.contains(o.adminId()))
                .map(Organization::slug)
                .toList();

        var report = new ReconciliationReport(orphanedResources, orphanedAdmins, unlinkedAdmins,
                missingStorage, missingAdmin, clock.instant());
        if (report.isConsistent()) {
            log.info("Tenant audit clean: {} organizations, {} storage resources",
                    organizations.size(), resources.size());
        } else {
            log.warn("Tenant audit found leftovers: orphanedStorage={}, orphanedAdmins={}, unlinkedAdmins={}, "
                            + "missingStorage={}, missingAdmin={}",
                    orphanedResources, orphanedAdmins, unlinkedAdmins, missingStorage, missingAdmin);
        }
        return report;
    }

    /**
     * Drops a storage resource no organization references, e.g. one retained by a rename.
     *
     * @return true if a resource was dropped, false if it did not exist
     * @throws IllegalArgumentException       if {@code resourceName} is not a tenant resource
     * @throws StorageResourceInUseException  if a live organization references it
     */
    public boolean reclaimStorage(String resourceName) {
        if (!StorageResourceNames.isTenantResource(resourceName)) {
            throw new IllegalArgumentException("'" + resourceName + "' is not a tenant storage resource");
        }
        Optional<Organization> owner = directory.listOrganizations().stream()
                .filter(o -> o.storageResourceName().equals(resourceName))
                .findFirst();
        if (owner.isPresent()) {
            throw new StorageResourceInUseException(resourceName, owner.get().slug());
        }
        if (!storage.exists(resourceName)) {
            return false;
        }
        storage.destroy(resourceName);
        log.info("Reclaimed storage resource {}", resourceName);
        return true;
    }

    /**
     * Deletes an administrator that owns no organization.
     *
     * @return true if deleted, false if it did not exist
     * @throws AdministratorInUseException if the administrator owns a live organization
     */
    public boolean reclaimAdministrator(String adminId) {
        if (directory.findAdminById(adminId).isEmpty()) {
            return false;
        }
        Optional<Organization> owned = directory.listOrganizations().stream()
                .filter(o -> o.adminId().equals(adminId))
                .findFirst();
        if (owned.isPresent()) {
            throw new AdministratorInUseException(adminId, owned.get().slug());
        }
        boolean deleted = directory.deleteAdministrator(adminId);
        log.info("Reclaimed administrator {}", adminId);
        return deleted;
    }

    /**
     * Restores missing or wrong administrator back-links from the organization records.
     *
     * @return number of administrators relinked
     */
    public int relinkAdministrators() {
        int relinked = 0;
        for (Organization organization : directory.listOrganizations()) {
            Optional<Administrator> admin = directory.findAdminById(organization.adminId());
            if (admin.isPresent() && !organization.id().equals(admin.get().organizationId())
                    && directory.linkAdministrator(organization.adminId(), organization.id())) {
                relinked++;
                log.info("Relinked administrator {} to organization {}", organization.adminId(), organization.id());
            }
        }
        return relinked;
    }
}
