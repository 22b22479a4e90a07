package com.sporetrack.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Caller scope handed in by the access-control layer. Every public operation takes one; the tenant
 * has already been authorized for the principal by the time it reaches the core.
 */
public record TenantContext(UUID tenantId, String principal) {

    public TenantContext {
        Objects.requireNonNull(tenantId, "tenantId");
    }

    public static TenantContext of(UUID tenantId) {
        return new TenantContext(tenantId, null);
    }
}
