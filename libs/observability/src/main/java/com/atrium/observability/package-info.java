/**
 * Logging and metrics support shared by the tenancy library and the tenant service.
 *
 * <ul>
 *   <li>{@link com.atrium.observability.CorrelationContextHolder}: per-operation MDC values
 *   <li>{@link com.atrium.observability.MetricFactory}: service-tagged Micrometer meters
 *   <li>{@link com.atrium.observability.SensitiveDataRedactor}: strips credentials from log data
 * </ul>
 */
package com.atrium.observability;
