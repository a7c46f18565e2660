package com.atrium.tenantservice.config;

import com.atrium.security.SigningAlgorithm;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the tenant service, bound from {@code atrium.tenant.*}.
 *
 * <pre>
 * atrium:
 *   tenant:
 *     backend: mongo
 *     mongo:
 *       uri: mongodb://localhost:27017
 *       master-database: master_db
 *     token:
 *       secret: ${ATRIUM_TOKEN_SECRET}
 *       algorithm: HS256
 *       ttl: 60m
 * </pre>
 *
 * <p>Everything is read once at startup; nothing here changes while the process runs.
 *
 * @param serviceName          value of the {@code service} tag on every meter
 * @param backend              where organizations and tenant documents live
 * @param mongo                MongoDB connection, used by the {@code mongo} backend only
 * @param token                signing configuration for administrator tokens. Required.
 * @param passwordHashStrength BCrypt cost factor (4..31)
 * @param auditOnStartup       run a reconciliation audit once the context is up
 */
@ConfigurationProperties(prefix = "atrium.tenant")
@Validated
public record TenantServiceProperties(
        String serviceName,
        Backend backend,
        @Valid Mongo mongo,
        @Valid @NotNull Token token,
        int passwordHashStrength,
        Boolean auditOnStartup) {

    public TenantServiceProperties {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = "tenant-service";
        }
        if (backend == null) {
            backend = Backend.MONGO;
        }
        if (mongo == null) {
            mongo = new Mongo(null, null);
        }
        if (passwordHashStrength <= 0) {
            passwordHashStrength = 10;
        }
        if (auditOnStartup == null) {
            auditOnStartup = Boolean.TRUE;
        }
    }

    public enum Backend {
        MONGO,
        IN_MEMORY
    }

    /**
     * @param uri            connection string
     * @param masterDatabase database holding the directory and every tenant collection
     */
    public record Mongo(String uri, String masterDatabase) {

        public Mongo {
            if (uri == null || uri.isBlank()) {
                uri = "mongodb://localhost:27017";
            }
            if (masterDatabase == null || masterDatabase.isBlank()) {
                masterDatabase = "master_db";
            }
        }
    }

    /**
     * @param secret    HMAC secret; at least as many bytes as the algorithm requires
     * @param algorithm HS256, HS384 or HS512
     * @param ttl       token lifetime
     */
    public record Token(@NotBlank String secret, SigningAlgorithm algorithm, Duration ttl) {

        public Token {
            if (algorithm == null) {
                algorithm = SigningAlgorithm.HS256;
            }
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                ttl = Duration.ofMinutes(60);
            }
        }

        @Override
        public String toString() {
            return "Token[secret=[REDACTED], algorithm=" + algorithm + ", ttl=" + ttl + "]";
        }
    }
}
