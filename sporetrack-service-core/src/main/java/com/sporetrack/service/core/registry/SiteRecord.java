package com.sporetrack.service.core.registry;

import java.util.UUID;

/** Site metadata owned by the registry collaborator. {@code tenantId} may be null for unassigned sites. */
public record SiteRecord(UUID siteId, UUID tenantId, UUID programId) {}
