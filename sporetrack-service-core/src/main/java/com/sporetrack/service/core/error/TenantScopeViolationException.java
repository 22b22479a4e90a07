package com.sporetrack.service.core.error;

import java.util.UUID;

public class TenantScopeViolationException extends SporetrackException {

    public TenantScopeViolationException(UUID callerTenant, UUID resourceTenant) {
        super("Resource belongs to tenant " + resourceTenant + ", caller is scoped to " + callerTenant);
    }
}
