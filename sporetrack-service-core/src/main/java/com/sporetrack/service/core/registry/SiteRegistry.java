package com.sporetrack.service.core.registry;

import java.util.Optional;
import java.util.UUID;

/** Read-only view of the tenant/program/site registry. */
public interface SiteRegistry {
    Optional<SiteRecord> findSite(UUID siteId);
}
