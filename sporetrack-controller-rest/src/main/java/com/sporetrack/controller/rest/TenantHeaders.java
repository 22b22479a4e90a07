package com.sporetrack.controller.rest;

import com.sporetrack.core.model.TenantContext;
import java.util.UUID;

/** Headers through which the access-control layer hands the authorized tenant to the store. */
final class TenantHeaders {

    static final String TENANT = "X-Tenant-Id";
    static final String PRINCIPAL = "X-Principal";

    private TenantHeaders() {}

    static TenantContext context(UUID tenantId, String principal) {
        return new TenantContext(tenantId, principal);
    }
}
