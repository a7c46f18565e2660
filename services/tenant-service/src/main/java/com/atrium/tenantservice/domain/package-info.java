/**
 * Administrator command facade over the tenant engine.
 *
 * <p>Depends on the tenancy and security libraries only; no transport types appear here.
 */
package com.atrium.tenantservice.domain;
