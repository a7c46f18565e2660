package com.atrium.tenantservice.infrastructure;

import com.atrium.observability.CorrelationContext;
import com.atrium.observability.CorrelationContextHolder;
import com.atrium.tenancy.provisioning.ReconciliationReport;
import com.atrium.tenancy.provisioning.TenantReconciler;
import java.util.UUID;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Audits the tenant store once on startup so leftovers from interrupted operations show up in
 * the log. Only reports; cleanup stays an explicit call on {@link TenantReconciler}.
 */
@Component
@Order(100)
@ConditionalOnProperty(prefix = "atrium.tenant", name = "audit-on-startup", havingValue = "true", matchIfMissing = true)
public class ReconciliationAuditRunner implements ApplicationRunner {

    private final TenantReconciler reconciler;
    private volatile ReconciliationReport lastReport;

    public ReconciliationAuditRunner(TenantReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @Override
    public void run(ApplicationArguments args) {
        var context = new CorrelationContext(UUID.randomUUID().toString(), null, null, "tenant.audit");
        lastReport = CorrelationContextHolder.callWithContext(context, reconciler::audit);
    }

    /** Report of the startup audit; null before it has run. */
    public ReconciliationReport lastReport() {
        return lastReport;
    }
}
