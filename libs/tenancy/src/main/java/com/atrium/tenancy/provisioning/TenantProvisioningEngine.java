package com.atrium.tenancy.provisioning;

import com.atrium.common.AtriumException;
import com.atrium.observability.MetricFactory;
import com.atrium.security.NotAuthorizedException;
import com.atrium.tenancy.DuplicateAdministratorException;
import com.atrium.tenancy.DuplicateOrganizationException;
import com.atrium.tenancy.OrganizationNotFoundException;
import com.atrium.tenancy.StorageResourceExistsException;
import com.atrium.tenancy.directory.Administrator;
import com.atrium.tenancy.directory.Organization;
import com.atrium.tenancy.directory.TenantDirectory;
import com.atrium.tenancy.naming.OrganizationNameNormalizer;
import com.atrium.tenancy.naming.StorageResourceNames;
import com.atrium.tenancy.storage.StorageMarker;
import com.atrium.tenancy.storage.TenantStorage;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, renames and deletes organizations together with their administrator and storage
 * resource.
 * <p>
 * Every operation is a sequence of independent single-record store operations with no
 * surrounding transaction and no rollback. A failure part-way leaves the earlier steps in
 * place and is logged with what was left behind; {@link TenantReconciler} reports those
 * leftovers. Slug uniqueness is checked up front and enforced again when the slug's storage
 * resource is created and by the directory's unique constraint. A caller that loses a race
 * on a slug always gets {@link DuplicateOrganizationException}.
 * <p>
 * The engine holds no mutable state and is safe to share between threads.
 */
public class TenantProvisioningEngine {

    private static final Logger log = LoggerFactory.getLogger(TenantProvisioningEngine.class);

    static final String METRIC_OPERATIONS = "atrium.tenant.operations";
    static final String METRIC_RENAME_COPY = "atrium.tenant.rename.copy";
    static final String METRIC_RENAME_DOCUMENTS = "atrium.tenant.rename.documents";

    private final TenantDirectory directory;
    private final TenantStorage storage;
    private final Clock clock;
    private final MetricFactory metrics;

    public TenantProvisioningEngine(
            TenantDirectory directory, TenantStorage storage, Clock clock, MetricFactory metrics) {
        if (directory == null || storage == null || clock == null || metrics == null) {
            throw new IllegalArgumentException("directory, storage, clock and metrics must not be null");
        }
        this.directory = directory;
        this.storage = storage;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Creates an organization, its storage resource and its administrator.
     * <p>
     * Order: storage resource, administrator, organization record, administrator back-link.
     * A crash before the organization record is written leaves an orphaned resource and/or
     * administrator, never an organization pointing at nothing.
     *
     * @param name         display name
     * @param email        administrator email
     * @param passwordHash administrator password, already hashed by the caller
     * @throws com.atrium.tenancy.InvalidNameException           if the name has no usable slug
     * @throws DuplicateOrganizationException                    if the slug or its storage resource is taken
     * @throws DuplicateAdministratorException                   if the email is taken
     */
    public OrganizationView create(String name, String email, String passwordHash) {
        return measured("create", () -> {
            String slug = OrganizationNameNormalizer.normalize(name);
            if (directory.findOrgBySlug(slug).isPresent()) {
                throw new DuplicateOrganizationException(slug);
            }
            if (directory.findAdminByEmail(email).isPresent()) {
                throw new DuplicateAdministratorException(email);
            }

            String resource = StorageResourceNames.forSlug(slug);
            Instant now = clock.instant();
            try {
                storage.provision(resource, StorageMarker.current(now));
            } catch (StorageResourceExistsException e) {
                throw slugTaken(slug, resource, e);
            }
            log.debug("Provisioned storage resource {}", resource);

            Administrator admin;
            Organization organization;
            try {
                admin = directory.insertAdministrator(email, passwordHash, now);
            } catch (RuntimeException e) {
                log.error("Create of '{}' failed after provisioning {}; the resource is orphaned", slug, resource);
                throw e;
            }
            try {
                organization = directory.insertOrganization(name, slug, resource, admin.id(), now);
            } catch (RuntimeException e) {
                log.error("Create of '{}' failed after provisioning {} and administrator {}; both are orphaned",
                        slug, resource, admin.id());
                throw e;
            }
            if (!directory.linkAdministrator(admin.id(), organization.id())) {
                log.error("Administrator {} vanished before it could be linked to organization {}",
                        admin.id(), organization.id());
            }

            log.info("Created organization '{}' ({}) with storage {}", slug, organization.id(), resource);
            return new OrganizationView(organization.id(), name, slug, resource, email);
        });
    }

    /**
     * Renames an organization and migrates its documents to the storage resource of the new slug.
     * <p>
     * The previous resource is not deleted. Documents keep their content but get new
     * identities. The organization stays usable during the copy; writes to the old resource
     * after a document has been copied are not carried over.
     *
     * @throws DuplicateOrganizationException                       if the new name's slug or its
     *                                                              storage resource is in use,
     *                                                              including by this organization
     * @throws OrganizationNotFoundException                        if {@code currentSlug} is unknown
     * @throws com.atrium.tenancy.TenantOperationInterruptedException if the copy is interrupted
     */
    public RenameResult rename(String currentSlug, String newName) {
        return measured("rename", () -> {
            String newSlug = OrganizationNameNormalizer.normalize(newName);
            if (directory.findOrgBySlug(newSlug).isPresent()) {
                throw new DuplicateOrganizationException(newSlug);
            }
            Organization organization = directory.findOrgBySlug(currentSlug)
                    .orElseThrow(() -> OrganizationNotFoundException.bySlug(currentSlug));

            String previousResource = organization.storageResourceName();
            String newResource = StorageResourceNames.forSlug(newSlug);

            long copied;
            try {
                copied = metrics.time(METRIC_RENAME_COPY, "Document copy duration during rename",
                        () -> storage.copyDocuments(previousResource, newResource));
            } catch (StorageResourceExistsException e) {
                throw slugTaken(newSlug, newResource, e);
            }
            metrics.distributionSummary(METRIC_RENAME_DOCUMENTS, "Documents copied per rename")
                    .record(copied);
            log.debug("Copied {} documents from {} to {}", copied, previousResource, newResource);

            boolean updated;
            try {
                updated = directory.updateOrganization(
                        organization.id(), newName, newSlug, newResource, clock.instant());
            } catch (RuntimeException e) {
                log.error("Rename of '{}' failed after copying into {}; the copy is orphaned",
                        currentSlug, newResource);
                throw e;
            }
            if (!updated) {
                log.error("Organization {} disappeared during rename; {} is orphaned", organization.id(), newResource);
                throw OrganizationNotFoundException.byId(organization.id());
            }

            log.info("Renamed organization '{}' to '{}'; previous storage {} retained",
                    currentSlug, newSlug, previousResource);
            return new RenameResult(previousResource, newResource, newSlug, copied);
        });
    }

    /**
     * Deletes an organization owned by {@code requesterAdminId}: storage resource first, then
     * administrator, then organization record.
     *
     * @throws OrganizationNotFoundException if the slug is unknown
     * @throws NotAuthorizedException        if the requester is not the owning administrator
     */
    public void delete(String slug, String requesterAdminId) {
        measured("delete", () -> {
            Organization organization = directory.findOrgBySlug(slug)
                    .orElseThrow(() -> OrganizationNotFoundException.bySlug(slug));
            if (!organization.adminId().equals(requesterAdminId)) {
                throw NotAuthorizedException.adminMismatch(requesterAdminId, organization.adminId());
            }

            storage.destroy(organization.storageResourceName());
            try {
                directory.deleteAdministrator(organization.adminId());
                directory.deleteOrganization(organization.id());
            } catch (RuntimeException e) {
                log.error("Delete of '{}' failed after dropping {}; directory records may remain",
                        slug, organization.storageResourceName());
                throw e;
            }
            log.info("Deleted organization '{}' ({}) and storage {}",
                    slug, organization.id(), organization.storageResourceName());
            return null;
        });
    }

    /**
     * Looks an organization up by display name; the name is normalized first.
     *
     * @throws com.atrium.tenancy.InvalidNameException if the name has no usable slug
     */
    public Optional<OrganizationView> findBySlug(String name) {
        String slug = OrganizationNameNormalizer.normalize(name);
        return directory.findOrgBySlug(slug).map(this::toView);
    }

    public Optional<OrganizationView> findById(String organizationId) {
        return directory.findOrgById(organizationId).map(this::toView);
    }

    private DuplicateOrganizationException slugTaken(
            String slug, String resource, StorageResourceExistsException cause) {
        if (directory.findOrgBySlug(slug).isPresent()) {
            return new DuplicateOrganizationException(slug, cause);
        }
        return DuplicateOrganizationException.storageTaken(slug, resource, cause);
    }

    private OrganizationView toView(Organization organization) {
        String adminEmail = directory.findAdminById(organization.adminId())
                .map(Administrator::email)
                .orElse("");
        return new OrganizationView(organization.id(), organization.name(), organization.slug(),
                organization.storageResourceName(), adminEmail);
    }

    private <T> T measured(String operation, Supplier<T> work) {
        String outcome = "success";
        try {
            return work.get();
        } catch (AtriumException e) {
            outcome = e.category().name().toLowerCase(Locale.ROOT);
            log.info("Organization {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            metrics.counter(METRIC_OPERATIONS, "Tenant lifecycle operations",
                    "operation", operation, "outcome", outcome).increment();
        }
    }
}
