package com.atrium.tenantservice.domain;

import com.atrium.observability.CorrelationContext;
import com.atrium.observability.CorrelationContextHolder;
import com.atrium.observability.SensitiveDataRedactor;
import com.atrium.security.AdminClaims;
import com.atrium.security.AuthorizationGate;
import com.atrium.security.CredentialService;
import com.atrium.security.InvalidCredentialsException;
import com.atrium.security.NotAuthorizedException;
import com.atrium.security.OwnershipEnforcer;
import com.atrium.tenancy.OrganizationNotFoundException;
import com.atrium.tenancy.directory.Administrator;
import com.atrium.tenancy.directory.TenantDirectory;
import com.atrium.tenancy.naming.OrganizationNameNormalizer;
import com.atrium.tenancy.provisioning.OrganizationView;
import com.atrium.tenancy.provisioning.RenameResult;
import com.atrium.tenancy.provisioning.TenantProvisioningEngine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

/**
 * Administrator commands against organizations: the flows a transport adapter exposes.
 *
 * <p>Input shape is validated here (Bean Validation, {@code ConstraintViolationException});
 * uniqueness, ownership and existence are left to the engine and the security components. Every
 * command runs in its own {@link CorrelationContext}, enriched with the administrator and
 * organization as soon as they are known.
 *
 * <p>Tokens are not revocation-aware, so each authenticated command re-resolves the organization
 * named in the token instead of trusting it.
 */
@Service
@Validated
public class OrganizationAdminService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationAdminService.class);

    private final TenantProvisioningEngine engine;
    private final TenantDirectory directory;
    private final CredentialService credentials;
    private final AuthorizationGate gate;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    public OrganizationAdminService(
            TenantProvisioningEngine engine,
            TenantDirectory directory,
            CredentialService credentials,
            AuthorizationGate gate) {
        this.engine = engine;
        this.directory = directory;
        this.credentials = credentials;
        this.gate = gate;
    }

    public OrganizationView createOrganization(@NotNull @Valid CreateOrganizationCommand command) {
        return inContext("organization.create", () -> {
            log.info("Create organization requested: {}", redactor.redact(fields(
                    "organizationName", command.organizationName(),
                    "email", command.email(),
                    "password", command.password())));
            String hash = credentials.hash(command.password());
            OrganizationView view = engine.create(command.organizationName(), command.email(), hash);
            CorrelationContextHolder.update(ctx -> ctx.withOrganization(view.id()));
            return view;
        });
    }

    /**
     * @throws OrganizationNotFoundException if no organization has the name's slug
     */
    public OrganizationView getOrganization(@NotBlank String organizationName) {
        return inContext("organization.get", () -> engine.findBySlug(organizationName)
                .orElseThrow(() -> OrganizationNotFoundException.bySlug(
                        OrganizationNameNormalizer.normalize(organizationName))));
    }

    /**
     * Exchanges administrator credentials for a signed token.
     *
     * @throws InvalidCredentialsException for an unknown email, a wrong password or an
     *                                     administrator without an organization; the three are
     *                                     indistinguishable to the caller
     */
    public String login(@NotNull @Valid LoginCommand command) {
        return inContext("admin.login", () -> {
            log.info("Login requested: {}", redactor.redact(fields(
                    "email", command.email(), "password", command.password())));
            Administrator admin = authenticateCredentials(command.email(), command.password());
            if (admin.organizationId() == null) {
                log.warn("Administrator {} has no organization; refusing login", admin.id());
                throw new InvalidCredentialsException();
            }
            CorrelationContextHolder.update(ctx -> ctx.withAdmin(admin.id()).withOrganization(admin.organizationId()));
            String token = credentials.issueToken(admin.id(), admin.organizationId(), admin.email());
            log.info("Issued token for administrator {}", admin.id());
            return token;
        });
    }

    /**
     * Renames the organization named in the caller's token.
     *
     * @throws InvalidCredentialsException   if the re-entered credentials do not match
     * @throws NotAuthorizedException        if the credentials belong to someone other than the token's subject
     * @throws OrganizationNotFoundException if the token's organization no longer exists
     */
    public RenameResult renameOrganization(
            String authorizationHeader, @NotNull @Valid RenameOrganizationCommand command) {
        return inContext("organization.rename", () -> {
            AdminClaims claims = authenticate(authorizationHeader);
            log.info("Rename organization requested: {}", redactor.redact(fields(
                    "organizationName", command.organizationName(),
                    "email", command.email(),
                    "password", command.password())));

            Administrator admin = authenticateCredentials(command.email(), command.password());
            OwnershipEnforcer.requireAdministrator(claims, admin.id());
            OrganizationView organization = engine.findById(claims.organizationId())
                    .orElseThrow(() -> OrganizationNotFoundException.byId(claims.organizationId()));

            return engine.rename(organization.slug(), command.organizationName());
        });
    }

    /**
     * Deletes the caller's organization. The requested name must resolve to the organization in
     * the token.
     *
     * @throws NotAuthorizedException if the token's organization is gone or is not the one named
     */
    public void deleteOrganization(String authorizationHeader, @NotNull @Valid DeleteOrganizationCommand command) {
        inContext("organization.delete", () -> {
            AdminClaims claims = authenticate(authorizationHeader);
            String requestedSlug = OrganizationNameNormalizer.normalize(command.organizationName());
            log.info("Delete organization requested: {}", requestedSlug);

            OrganizationView organization = engine.findById(claims.organizationId())
                    .filter(view -> view.slug().equals(requestedSlug))
                    .orElseThrow(() -> NotAuthorizedException.organizationMismatch(
                            claims.organizationId(), requestedSlug));

            engine.delete(organization.slug(), claims.adminId());
            return null;
        });
    }

    private AdminClaims authenticate(String authorizationHeader) {
        AdminClaims claims = gate.authenticate(authorizationHeader);
        CorrelationContextHolder.update(ctx -> ctx.withAdmin(claims.adminId()).withOrganization(claims.organizationId()));
        return claims;
    }

    private Administrator authenticateCredentials(String email, String password) {
        Administrator admin = directory.findAdminByEmail(email).orElseThrow(InvalidCredentialsException::new);
        if (!credentials.verify(password, admin.passwordHash())) {
            throw new InvalidCredentialsException();
        }
        return admin;
    }

    private static <T> T inContext(String operation, Supplier<T> work) {
        var context = new CorrelationContext(UUID.randomUUID().toString(), null, null, operation);
        return CorrelationContextHolder.callWithContext(context, work);
    }

    private static Map<String, Object> fields(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
