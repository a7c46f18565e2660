package com.atrium.tenancy.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import com.atrium.observability.MetricFactory;
import com.atrium.security.NotAuthorizedException;
import com.atrium.security.testing.MutableClock;
import com.atrium.tenancy.DuplicateAdministratorException;
import com.atrium.tenancy.DuplicateOrganizationException;
import com.atrium.tenancy.InvalidNameException;
import com.atrium.tenancy.OrganizationNotFoundException;
import com.atrium.tenancy.StorageResourceExistsException;
import com.atrium.tenancy.directory.Administrator;
import com.atrium.tenancy.directory.Organization;
import com.atrium.tenancy.storage.StorageMarker;
import com.atrium.tenancy.testing.InMemoryTenantDirectory;
import com.atrium.tenancy.testing.InMemoryTenantStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TenantProvisioningEngine")
class TenantProvisioningEngineTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
    private static final String HASH = "$2a$04$abcdefghijklmnopqrstuuN7bM1Q1X3i6nZqUeYl3zHq3M3R6x8a2";

    private InMemoryTenantDirectory directory;
    private InMemoryTenantStorage storage;
    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private TenantProvisioningEngine engine;

    @BeforeEach
    void setUp() {
        directory = new InMemoryTenantDirectory();
        storage = new InMemoryTenantStorage();
        clock = new MutableClock(START);
        registry = new SimpleMeterRegistry();
        engine = new TenantProvisioningEngine(directory, storage, clock, new MetricFactory(registry, "tenant-test"));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("materializes organization, administrator and seeded storage")
        void createsEverything() {
            OrganizationView view = engine.create("Acme Inc", "owner@acme.test", HASH);

            assertThat(view.name()).isEqualTo("Acme Inc");
            assertThat(view.slug()).isEqualTo("acme-inc");
            assertThat(view.storageResourceName()).isEqualTo("tenant_acme-inc");
            assertThat(view.adminEmail()).isEqualTo("owner@acme.test");

            Organization organization = directory.findOrgBySlug("acme-inc").orElseThrow();
            assertThat(organization.id()).isEqualTo(view.id());
            assertThat(organization.createdAt()).isEqualTo(START);
            assertThat(organization.updatedAt()).isEqualTo(START);

            Administrator admin = directory.findAdminByEmail("owner@acme.test").orElseThrow();
            assertThat(admin.passwordHash()).isEqualTo(HASH);
            assertThat(admin.organizationId()).isEqualTo(organization.id());
            assertThat(organization.adminId()).isEqualTo(admin.id());

            assertThat(storage.documents("tenant_acme-inc")).containsExactly(Map.of(
                    StorageMarker.FIELD_SCHEMA_VERSION, 1,
                    StorageMarker.FIELD_CREATED_AT, START));
        }

        @Test
        @DisplayName("findBySlug resolves the created organization from its display name")
        void findBySlug() {
            engine.create("Acme Inc", "owner@acme.test", HASH);

            assertThat(engine.findBySlug("acme-inc")).hasValueSatisfying(view -> {
                assertThat(view.storageResourceName()).isEqualTo("tenant_acme-inc");
                assertThat(view.adminEmail()).isEqualTo("owner@acme.test");
            });
            assertThat(engine.findBySlug("ACME inc.")).isPresent();
            assertThat(engine.findBySlug("Globex")).isEmpty();
        }

        @Test
        @DisplayName("rejects a name normalizing to an existing slug")
        void duplicateSlug() {
            engine.create("Acme Inc", "owner@acme.test", HASH);

            assertThatThrownBy(() -> engine.create("ACME, inc.", "other@acme.test", HASH))
                    .isInstanceOf(DuplicateOrganizationException.class)
                    .satisfies(e -> assertThat(((DuplicateOrganizationException) e).slug()).isEqualTo("acme-inc"));
            assertThat(directory.listAdministrators()).hasSize(1);
            assertThat(storage.listResources()).containsExactly("tenant_acme-inc");
        }

        @Test
        @DisplayName("rejects a registered email before touching storage")
        void duplicateEmail() {
            engine.create("Acme Inc", "owner@acme.test", HASH);

            assertThatThrownBy(() -> engine.create("Globex", "owner@acme.test", HASH))
                    .isInstanceOf(DuplicateAdministratorException.class);
            assertThat(storage.exists("tenant_globex")).isFalse();
        }

        @Test
        @DisplayName("rejects a name without usable characters")
        void invalidName() {
            assertThatThrownBy(() -> engine.create("!!!", "owner@acme.test", HASH))
                    .isInstanceOf(InvalidNameException.class);
            assertThat(storage.listResources()).isEmpty();
        }

        @Test
        @DisplayName("refuses to reuse a storage resource left behind by a rename")
        void retainedResourceBlocksSlug() {
            engine.create("Acme", "owner@acme.test", HASH);
            engine.rename("acme", "Acme Two");

            assertThatThrownBy(() -> engine.create("Acme", "new@acme.test", HASH))
                    .isInstanceOf(DuplicateOrganizationException.class)
                    .hasCauseInstanceOf(StorageResourceExistsException.class)
                    .hasMessageContaining("tenant_acme")
                    .hasMessageContaining("TenantReconciler.reclaimStorage");
            assertThat(directory.findAdminByEmail("new@acme.test")).isEmpty();
        }

        @Test
        @DisplayName("accepts the name again once the retained resource is reclaimed")
        void reclaimedResourceFreesSlug() {
            engine.create("Acme", "owner@acme.test", HASH);
            engine.rename("acme", "Acme Two");
            storage.destroy("tenant_acme");

            assertThat(engine.create("Acme", "new@acme.test", HASH).storageResourceName())
                    .isEqualTo("tenant_acme");
        }

        @Test
        @DisplayName("counts outcomes per operation")
        void metrics() {
            engine.create("Acme Inc", "owner@acme.test", HASH);
            try {
                engine.create("Acme Inc", "owner2@acme.test", HASH);
            } catch (DuplicateOrganizationException expected) {
                // counted below
            }

            assertThat(registry.get(TenantProvisioningEngine.METRIC_OPERATIONS)
                    .tags("operation", "create", "outcome", "success").counter().count()).isEqualTo(1.0);
            assertThat(registry.get(TenantProvisioningEngine.METRIC_OPERATIONS)
                    .tags("operation", "create", "outcome", "conflict").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("concurrent creates of one slug admit exactly one winner")
        void concurrentCreates() throws Exception {
            int contenders = 8;
            ExecutorService pool = Executors.newFixedThreadPool(contenders);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<OrganizationView>> futures = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                String email = "owner" + i + "@acme.test";
                futures.add(pool.submit(() -> {
                    start.await();
                    return engine.create("Acme Inc", email, HASH);
                }));
            }
            start.countDown();

            List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
            int winners = 0;
            for (Future<OrganizationView> future : futures) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                    winners++;
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }
            pool.shutdownNow();

            assertThat(winners).isEqualTo(1);
            assertThat(failures).hasSize(contenders - 1)
                    .allSatisfy(failure -> assertThat(failure)
                            .isInstanceOf(DuplicateOrganizationException.class)
                            .extracting(f -> ((AtriumException) f).category())
                            .isEqualTo(FailureCategory.CONFLICT));
            assertThat(directory.listOrganizations()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("rename")
    class Rename {

        @BeforeEach
        void seed() {
            engine.create("Acme Inc", "owner@acme.test", HASH);
            storage.insertDocument("tenant_acme-inc", Map.of("sku", "A-1", "qty", 3));
            storage.insertDocument("tenant_acme-inc", Map.of("sku", "B-2", "qty", 7));
        }

        @Test
        @DisplayName("copies every document and moves the organization to the new resource")
        void copiesAndUpdates() {
            clock.advance(Duration.ofMinutes(5));

            RenameResult result = engine.rename("acme-inc", "Acme Global");

            assertThat(result.previousStorageResourceName()).isEqualTo("tenant_acme-inc");
            assertThat(result.storageResourceName()).isEqualTo("tenant_acme-global");
            assertThat(result.slug()).isEqualTo("acme-global");
            assertThat(result.documentsCopied()).isEqualTo(3);

            assertThat(storage.documents("tenant_acme-global"))
                    .containsExactlyElementsOf(storage.documents("tenant_acme-inc"));

            Organization organization = directory.findOrgBySlug("acme-global").orElseThrow();
            assertThat(organization.name()).isEqualTo("Acme Global");
            assertThat(organization.storageResourceName()).isEqualTo("tenant_acme-global");
            assertThat(organization.createdAt()).isEqualTo(START);
            assertThat(organization.updatedAt()).isEqualTo(START.plus(Duration.ofMinutes(5)));
            assertThat(directory.findOrgBySlug("acme-inc")).isEmpty();
        }

        @Test
        @DisplayName("reports an existing target resource as a duplicate and leaves the organization alone")
        void targetResourceExists() {
            storage.provision("tenant_acme-global", StorageMarker.current(START));

            assertThatThrownBy(() -> engine.rename("acme-inc", "Acme Global"))
                    .isInstanceOf(DuplicateOrganizationException.class)
                    .hasCauseInstanceOf(StorageResourceExistsException.class)
                    .hasMessageContaining("tenant_acme-global");

            assertThat(directory.findOrgBySlug("acme-inc")).hasValueSatisfying(organization ->
                    assertThat(organization.storageResourceName()).isEqualTo("tenant_acme-inc"));
            assertThat(storage.countDocuments("tenant_acme-global")).isEqualTo(1);
        }

        @Test
        @DisplayName("retains the previous storage resource")
        void oldResourceSurvives() {
            engine.rename("acme-inc", "Acme Global");

            assertThat(storage.exists("tenant_acme-inc")).isTrue();
            assertThat(storage.countDocuments("tenant_acme-inc")).isEqualTo(3);
        }

        @Test
        @DisplayName("regenerates document identity on copy")
        void identityRegenerated() {
            engine.rename("acme-inc", "Acme Global");

            List<Object> oldIds = storage.rawDocuments("tenant_acme-inc").stream()
                    .map(d -> d.get("_id")).toList();
            List<Object> newIds = storage.rawDocuments("tenant_acme-global").stream()
                    .map(d -> d.get("_id")).toList();
            assertThat(newIds).hasSize(3).doesNotContainAnyElementsOf(oldIds);
        }

        @Test
        @DisplayName("rejects a slug held by another organization and changes nothing")
        void duplicateTarget() {
            engine.create("Globex", "owner@globex.test", HASH);

            assertThatThrownBy(() -> engine.rename("acme-inc", "GLOBEX"))
                    .isInstanceOf(DuplicateOrganizationException.class);

            Organization organization = directory.findOrgBySlug("acme-inc").orElseThrow();
            assertThat(organization.name()).isEqualTo("Acme Inc");
            assertThat(organization.storageResourceName()).isEqualTo("tenant_acme-inc");
            assertThat(storage.countDocuments("tenant_acme-inc")).isEqualTo(3);
            assertThat(storage.countDocuments("tenant_globex")).isEqualTo(1);
        }

        @Test
        @DisplayName("renaming to a name with the same slug is a duplicate")
        void sameSlug() {
            assertThatThrownBy(() -> engine.rename("acme-inc", "ACME inc"))
                    .isInstanceOf(DuplicateOrganizationException.class);
        }

        @Test
        @DisplayName("unknown current slug is not found")
        void unknownSlug() {
            assertThatThrownBy(() -> engine.rename("initech", "Initrode"))
                    .isInstanceOf(OrganizationNotFoundException.class);
            assertThat(storage.exists("tenant_initrode")).isFalse();
        }

        @Test
        @DisplayName("records copy duration and document count")
        void metrics() {
            engine.rename("acme-inc", "Acme Global");

            assertThat(registry.get(TenantProvisioningEngine.METRIC_RENAME_COPY).timer().count()).isEqualTo(1);
            assertThat(registry.get(TenantProvisioningEngine.METRIC_RENAME_DOCUMENTS).summary().totalAmount())
                    .isEqualTo(3.0);
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        private OrganizationView acme;
        private String ownerId;

        @BeforeEach
        void seed() {
            acme = engine.create("Acme Inc", "owner@acme.test", HASH);
            ownerId = directory.findAdminByEmail("owner@acme.test").orElseThrow().id();
        }

        @Test
        @DisplayName("owner removes organization, administrator and storage")
        void ownerDeletes() {
            engine.delete("acme-inc", ownerId);

            assertThat(engine.findBySlug("acme-inc")).isEmpty();
            assertThat(directory.findOrgById(acme.id())).isEmpty();
            assertThat(directory.findAdminById(ownerId)).isEmpty();
            assertThat(storage.exists("tenant_acme-inc")).isFalse();
        }

        @Test
        @DisplayName("another administrator is refused and nothing changes")
        void strangerRefused() {
            engine.create("Globex", "owner@globex.test", HASH);
            String strangerId = directory.findAdminByEmail("owner@globex.test").orElseThrow().id();

            assertThatThrownBy(() -> engine.delete("acme-inc", strangerId))
                    .isInstanceOf(NotAuthorizedException.class);

            assertThat(directory.findOrgById(acme.id())).isPresent();
            assertThat(directory.findAdminById(ownerId)).isPresent();
            assertThat(storage.exists("tenant_acme-inc")).isTrue();
        }

        @Test
        @DisplayName("unknown slug is not found")
        void unknownSlug() {
            assertThatThrownBy(() -> engine.delete("initech", ownerId))
                    .isInstanceOf(OrganizationNotFoundException.class);
        }

        @Test
        @DisplayName("the name becomes available again")
        void nameReusable() {
            engine.delete("acme-inc", ownerId);

            assertThat(engine.create("Acme Inc", "owner@acme.test", HASH).slug()).isEqualTo("acme-inc");
        }
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        @DisplayName("findById returns the same view as findBySlug")
        void byId() {
            OrganizationView created = engine.create("Acme Inc", "owner@acme.test", HASH);

            assertThat(engine.findById(created.id())).contains(created);
            assertThat(engine.findById("missing")).isEmpty();
        }

        @Test
        @DisplayName("admin email is empty when the administrator record is gone")
        void missingAdministrator() {
            engine.create("Acme Inc", "owner@acme.test", HASH);
            directory.deleteAdministrator(directory.findAdminByEmail("owner@acme.test").orElseThrow().id());

            assertThat(engine.findBySlug("Acme Inc")).hasValueSatisfying(
                    view -> assertThat(view.adminEmail()).isEmpty());
        }
    }
}
