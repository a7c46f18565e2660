package com.atrium.tenantservice.config;

import com.atrium.observability.MetricFactory;
import com.atrium.security.AuthorizationGate;
import com.atrium.security.CredentialService;
import com.atrium.security.TokenSettings;
import com.atrium.tenancy.directory.TenantDirectory;
import com.atrium.tenancy.mongo.MongoTenantDirectory;
import com.atrium.tenancy.mongo.MongoTenantStorage;
import com.atrium.tenancy.provisioning.TenantProvisioningEngine;
import com.atrium.tenancy.provisioning.TenantReconciler;
import com.atrium.tenancy.storage.TenantStorage;
import com.atrium.tenancy.testing.InMemoryTenantDirectory;
import com.atrium.tenancy.testing.InMemoryTenantStorage;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the tenancy and security components from {@link TenantServiceProperties}. The libraries
 * take all configuration through constructors; this is the only place that reads properties.
 */
@Configuration(proxyBeanMethods = false)
public class TenancyConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TenancyConfiguration.class);

    static final String BACKEND_PROPERTY = "atrium.tenant.backend";

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    CredentialService credentialService(TenantServiceProperties properties, Clock clock) {
        var token = properties.token();
        var settings = new TokenSettings(token.secret(), token.algorithm(), token.ttl());
        log.info("Administrator tokens: {}", settings);
        return new CredentialService(settings, properties.passwordHashStrength(), clock);
    }

    @Bean
    AuthorizationGate authorizationGate(CredentialService credentialService) {
        return new AuthorizationGate(credentialService);
    }

    @Bean
    MetricFactory metricFactory(MeterRegistry meterRegistry, TenantServiceProperties properties) {
        return new MetricFactory(meterRegistry, properties.serviceName());
    }

    @Bean
    TenantProvisioningEngine tenantProvisioningEngine(
            TenantDirectory directory, TenantStorage storage, Clock clock, MetricFactory metricFactory) {
        return new TenantProvisioningEngine(directory, storage, clock, metricFactory);
    }

    @Bean
    TenantReconciler tenantReconciler(TenantDirectory directory, TenantStorage storage, Clock clock) {
        return new TenantReconciler(directory, storage, clock);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "mongo", matchIfMissing = true)
    static class MongoBackend {

        @Bean(destroyMethod = "close")
        MongoClient mongoClient(TenantServiceProperties properties) {
            return MongoClients.create(properties.mongo().uri());
        }

        @Bean
        MongoDatabase masterDatabase(MongoClient mongoClient, TenantServiceProperties properties) {
            log.info("Tenant backend: MongoDB database '{}'", properties.mongo().masterDatabase());
            return mongoClient.getDatabase(properties.mongo().masterDatabase());
        }

        @Bean
        TenantDirectory tenantDirectory(MongoDatabase masterDatabase) {
            var directory = new MongoTenantDirectory(masterDatabase);
            directory.ensureIndexes();
            return directory;
        }

        @Bean
        TenantStorage tenantStorage(MongoDatabase masterDatabase) {
            return new MongoTenantStorage(masterDatabase);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "in-memory")
    static class InMemoryBackend {

        @Bean
        TenantDirectory tenantDirectory() {
            log.warn("Tenant backend: in-memory; nothing survives a restart");
            return new InMemoryTenantDirectory();
        }

        @Bean
        TenantStorage tenantStorage() {
            return new InMemoryTenantStorage();
        }
    }
}
