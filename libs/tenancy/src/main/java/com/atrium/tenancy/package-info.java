/**
 * Tenant lifecycle engine: organizations, their administrators and their dedicated storage
 * resources.
 *
 * <ul>
 *   <li>{@code naming}: slug derivation and storage resource names
 *   <li>{@code directory}: organization and administrator records
 *   <li>{@code storage}: per-tenant document containers
 *   <li>{@code provisioning}: create / rename / delete and reconciliation
 *   <li>{@code mongo}: MongoDB backends
 *   <li>{@code testing}: in-memory backends
 * </ul>
 *
 * <p>The exceptions in this package extend {@link com.atrium.common.AtriumException}.
 */
package com.atrium.tenancy;
