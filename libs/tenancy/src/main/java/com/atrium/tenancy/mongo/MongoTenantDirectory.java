package com.atrium.tenancy.mongo;

import com.atrium.tenancy.DuplicateAdministratorException;
import com.atrium.tenancy.DuplicateOrganizationException;
import com.atrium.tenancy.directory.Administrator;
import com.atrium.tenancy.directory.Organization;
import com.atrium.tenancy.directory.TenantDirectory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Updates;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directory backed by the {@code organizations} and {@code admins} collections of the master
 * database. Identities are ObjectId hex strings; an identity that is not valid hex simply
 * matches nothing.
 * <p>
 * Call {@link #ensureIndexes()} once at startup; uniqueness depends on those indexes.
 */
public class MongoTenantDirectory implements TenantDirectory {

    private static final Logger log = LoggerFactory.getLogger(MongoTenantDirectory.class);

    public static final String ORGANIZATIONS = "organizations";
    public static final String ADMINS = "admins";

    static final String SLUG_INDEX = "uniq_slug";
    static final String EMAIL_INDEX = "uniq_email";

    private final MongoCollection<Document> organizations;
    private final MongoCollection<Document> admins;

    public MongoTenantDirectory(MongoDatabase database) {
        if (database == null) {
            throw new IllegalArgumentException("database must not be null");
        }
        this.organizations = database.getCollection(ORGANIZATIONS);
        this.admins = database.getCollection(ADMINS);
    }

    /** Creates the unique slug and email indexes if they do not exist. */
    public void ensureIndexes() {
        organizations.createIndex(Indexes.ascending("slug"), new IndexOptions().name(SLUG_INDEX).unique(true));
        admins.createIndex(Indexes.ascending("email"), new IndexOptions().name(EMAIL_INDEX).unique(true));
        log.info("Ensured unique indexes on {}.slug and {}.email", ORGANIZATIONS, ADMINS);
    }

    @Override
    public Optional<Organization> findOrgBySlug(String slug) {
        return Optional.ofNullable(organizations.find(Filters.eq("slug", slug)).first())
                .map(MongoTenantDirectory::toOrganization);
    }

    @Override
    public Optional<Organization> findOrgById(String organizationId) {
        return byId(organizationId)
                .map(filter -> organizations.find(filter).first())
                .map(MongoTenantDirectory::toOrganization);
    }

    @Override
    public Optional<Administrator> findAdminByEmail(String email) {
        return Optional.ofNullable(admins.find(Filters.eq("email", email)).first())
                .map(MongoTenantDirectory::toAdministrator);
    }

    @Override
    public Optional<Administrator> findAdminById(String adminId) {
        return byId(adminId)
                .map(filter -> admins.find(filter).first())
                .map(MongoTenantDirectory::toAdministrator);
    }

    @Override
    public Administrator insertAdministrator(String email, String passwordHash, Instant createdAt) {
        ObjectId id = new ObjectId();
        Document document = new Document("_id", id)
                .append("email", email)
                .append("password", passwordHash)
                .append("organizationId", null)
                .append("createdAt", Date.from(createdAt));
        try {
            admins.insertOne(document);
        } catch (MongoWriteException e) {
            if (MongoErrors.isDuplicateKey(e)) {
                throw new DuplicateAdministratorException(email, e);
            }
            throw e;
        }
        return new Administrator(id.toHexString(), email, passwordHash, null, createdAt);
    }

    @Override
    public Organization insertOrganization(
            String name, String slug, String storageResourceName, String adminId, Instant createdAt) {
        ObjectId id = new ObjectId();
        Document document = new Document("_id", id)
                .append("name", name)
                .append("slug", slug)
                .append("collectionName", storageResourceName)
                .append("adminId", adminId)
                .append("createdAt", Date.from(createdAt))
                .append("updatedAt", Date.from(createdAt));
        try {
            organizations.insertOne(document);
        } catch (MongoWriteException e) {
            if (MongoErrors.isDuplicateKey(e)) {
                throw new DuplicateOrganizationException(slug, e);
            }
            throw e;
        }
        return new Organization(id.toHexString(), name, slug, storageResourceName, adminId, createdAt, createdAt);
    }

    @Override
    public boolean linkAdministrator(String adminId, String organizationId) {
        return byId(adminId)
                .map(filter -> admins.updateOne(filter, Updates.set("organizationId", organizationId)))
                .map(result -> result.getMatchedCount() > 0)
                .orElse(false);
    }

    @Override
    public boolean updateOrganization(
            String organizationId, String name, String slug, String storageResourceName, Instant updatedAt) {
        Optional<Bson> filter = byId(organizationId);
        if (filter.isEmpty()) {
            return false;
        }
        Bson update = Updates.combine(
                Updates.set("name", name),
                Updates.set("slug", slug),
                Updates.set("collectionName", storageResourceName),
                Updates.set("updatedAt", Date.from(updatedAt)));
        try {
            return organizations.updateOne(filter.get(), update).getMatchedCount() > 0;
        } catch (MongoWriteException e) {
            if (MongoErrors.isDuplicateKey(e)) {
                throw new DuplicateOrganizationException(slug, e);
            }
            throw e;
        }
    }

    @Override
    public boolean deleteAdministrator(String adminId) {
        return byId(adminId)
                .map(filter -> admins.deleteOne(filter).getDeletedCount() > 0)
                .orElse(false);
    }

    @Override
    public boolean deleteOrganization(String organizationId) {
        return byId(organizationId)
                .map(filter -> organizations.deleteOne(filter).getDeletedCount() > 0)
                .orElse(false);
    }

    @Override
    public List<Organization> listOrganizations() {
        List<Organization> result = new ArrayList<>();
        for (Document document : organizations.find()) {
            result.add(toOrganization(document));
        }
        return result;
    }

    @Override
    public List<Administrator> listAdministrators() {
        List<Administrator> result = new ArrayList<>();
        for (Document document : admins.find()) {
            result.add(toAdministrator(document));
        }
        return result;
    }

    private static Optional<Bson> byId(String id) {
        if (id == null || !ObjectId.isValid(id)) {
            return Optional.empty();
        }
        return Optional.of(Filters.eq("_id", new ObjectId(id)));
    }

    private static Organization toOrganization(Document document) {
        return new Organization(
                document.getObjectId("_id").toHexString(),
                document.getString("name"),
                document.getString("slug"),
                document.getString("collectionName"),
                document.getString("adminId"),
                toInstant(document.getDate("createdAt")),
                toInstant(document.getDate("updatedAt")));
    }

    private static Administrator toAdministrator(Document document) {
        return new Administrator(
                document.getObjectId("_id").toHexString(),
                document.getString("email"),
                document.getString("password"),
                document.getString("organizationId"),
                toInstant(document.getDate("createdAt")));
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
