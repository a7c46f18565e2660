package com.atrium.tenantservice;

import com.atrium.tenantservice.config.TenantServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Spring Boot host for the tenant lifecycle engine.
 *
 * <p>Wires the directory and storage backends selected by {@code atrium.tenant.backend}, the
 * credential components and the {@link com.atrium.tenantservice.domain.OrganizationAdminService}
 * facade that transport adapters call. Boot's own MongoDB auto-configuration is excluded; the
 * client is built from {@code atrium.tenant.mongo.*} only when the MongoDB backend is active.
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
@EnableConfigurationProperties(TenantServiceProperties.class)
public class TenantServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TenantServiceApplication.class, args);
    }
}
