package com.sporetrack.service.core.series;

import com.sporetrack.core.model.SeriesKey;
import com.sporetrack.core.model.SeriesTemplate;
import com.sporetrack.core.model.TenantContext;
import com.sporetrack.service.core.error.MissingTenantException;
import com.sporetrack.service.core.error.TenantScopeViolationException;
import com.sporetrack.service.core.registry.SiteRecord;
import com.sporetrack.service.core.registry.SiteRegistry;
import org.springframework.stereotype.Component;

/**
 * Computes the logical series identity of a submission from the site registry. Pure lookup, no side effects.
 * The tenant always comes from the owning site; a site without one blocks ingestion.
 */
@Component
public class SeriesKeyResolver {

    private final SiteRegistry siteRegistry;

    public SeriesKeyResolver(SiteRegistry siteRegistry) {
        this.siteRegistry = siteRegistry;
    }

    public SeriesKey resolve(TenantContext ctx, SeriesTemplate template) {
        if (template.programId() == null) {
            throw new IllegalArgumentException("programId is required");
        }
        if (template.seriesCode() == null || template.seriesCode().isBlank()) {
            throw new IllegalArgumentException("seriesCode is required");
        }
        SiteRecord site = siteRegistry
                .findSite(template.siteId())
                .orElseThrow(() ->
                        new MissingTenantException(template.siteId(), "Unknown site " + template.siteId()));
        if (site.tenantId() == null) {
            throw new MissingTenantException(site.siteId(), "Site " + site.siteId() + " has no tenant");
        }
        if (!site.tenantId().equals(ctx.tenantId())) {
            throw new TenantScopeViolationException(ctx.tenantId(), site.tenantId());
        }
        if (site.programId() != null && !site.programId().equals(template.programId())) {
            throw new IllegalArgumentException(
                    "Site " + site.siteId() + " does not belong to program " + template.programId());
        }
        return new SeriesKey(
                site.tenantId(), template.programId(), site.siteId(), template.seriesCode().trim());
    }
}
