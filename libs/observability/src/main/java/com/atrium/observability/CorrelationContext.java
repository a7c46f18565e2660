package com.atrium.observability;

/**
 * Immutable correlation context for one administrative operation.
 * <p>
 * Every command entering the tenant engine (create, rename, delete, login) establishes a
 * {@code CorrelationContext}. Its values are written to SLF4J MDC by
 * {@link CorrelationContextHolder} so every log line of the operation can be tied back to the
 * request and the organization it touched.
 *
 * @param correlationId  unique ID for the operation (propagated from the caller when present)
 * @param organizationId organization the operation targets (nullable before creation)
 * @param adminId        authenticated administrator (nullable for unauthenticated commands)
 * @param operation      short operation name, e.g. {@code organization.create}
 */
public record CorrelationContext(
        String correlationId,
        String organizationId,
        String adminId,
        String operation
) {

    public static final String MDC_CORRELATION_ID = "correlationId";

    public static final String MDC_ORGANIZATION_ID = "organizationId";

    public static final String MDC_ADMIN_ID = "adminId";

    public static final String MDC_OPERATION = "operation";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy bound to the given organization, e.g. once a create has assigned an ID.
     */
    public CorrelationContext withOrganization(String organizationId) {
        return new CorrelationContext(correlationId, organizationId, adminId, operation);
    }

    /**
     * Returns a copy bound to the given administrator, e.g. once a token has been verified.
     */
    public CorrelationContext withAdmin(String adminId) {
        return new CorrelationContext(correlationId, organizationId, adminId, operation);
    }
}
