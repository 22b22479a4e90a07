package com.sporetrack.service.core.series;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sporetrack.core.model.ReadingKind;
import com.sporetrack.core.model.SeriesKey;
import com.sporetrack.core.model.SeriesTemplate;
import com.sporetrack.core.model.TenantContext;
import com.sporetrack.service.core.error.MissingTenantException;
import com.sporetrack.service.core.error.TenantScopeViolationException;
import com.sporetrack.service.core.registry.SiteRecord;
import com.sporetrack.service.core.registry.SiteRegistry;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class SeriesKeyResolverTest {

    private final UUID tenant = UUID.randomUUID();
    private final UUID program = UUID.randomUUID();
    private final UUID site = UUID.randomUUID();
    private final SiteRegistry registry = Mockito.mock(SiteRegistry.class);
    private final SeriesKeyResolver resolver = new SeriesKeyResolver(registry);

    @Test
    void resolvesTenantFromOwningSite() {
        Mockito.when(registry.findSite(site)).thenReturn(Optional.of(new SiteRecord(site, tenant, program)));

        SeriesKey key = resolver.resolve(TenantContext.of(tenant), template(program, " P001 "));

        assertThat(key).isEqualTo(new SeriesKey(tenant, program, site, "P001"));
        assertThat(key.routingKey().programId()).isEqualTo(program);
    }

    @Test
    void siteWithoutTenantIsRejected() {
        Mockito.when(registry.findSite(site)).thenReturn(Optional.of(new SiteRecord(site, null, program)));

        assertThatThrownBy(() -> resolver.resolve(TenantContext.of(tenant), template(program, "P001")))
                .isInstanceOf(MissingTenantException.class)
                .hasMessageContaining(site.toString());
    }

    @Test
    void unknownSiteIsRejected() {
        Mockito.when(registry.findSite(site)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.resolve(TenantContext.of(tenant), template(program, "P001")))
                .isInstanceOf(MissingTenantException.class);
    }

    @Test
    void callerScopedToAnotherTenantIsRejected() {
        Mockito.when(registry.findSite(site)).thenReturn(Optional.of(new SiteRecord(site, tenant, program)));

        assertThatThrownBy(() -> resolver.resolve(TenantContext.of(UUID.randomUUID()), template(program, "P001")))
                .isInstanceOf(TenantScopeViolationException.class);
    }

    @Test
    void siteOfDifferentProgramIsRejected() {
        Mockito.when(registry.findSite(site)).thenReturn(Optional.of(new SiteRecord(site, tenant, program)));

        assertThatThrownBy(() -> resolver.resolve(TenantContext.of(tenant), template(UUID.randomUUID(), "P001")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankSeriesCodeIsRejectedBeforeLookup() {
        assertThatThrownBy(() -> resolver.resolve(TenantContext.of(tenant), template(program, "  ")))
                .isInstanceOf(IllegalArgumentException.class);
        Mockito.verifyNoInteractions(registry);
    }

    private SeriesTemplate template(UUID programId, String seriesCode) {
        return new SeriesTemplate(site, programId, UUID.randomUUID(), seriesCode, ReadingKind.GROWTH_INDEX, null);
    }
}
