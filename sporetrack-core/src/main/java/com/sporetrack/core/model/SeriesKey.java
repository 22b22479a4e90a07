package com.sporetrack.core.model;

import java.util.Objects;
import java.util.UUID;

/** Logical series identity of an observation. Used for routing and for predecessor lookup. */
public record SeriesKey(UUID tenantId, UUID programId, UUID siteId, String seriesCode) {

    public SeriesKey {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(programId, "programId");
        Objects.requireNonNull(seriesCode, "seriesCode");
    }

    public RoutingKey routingKey() {
        return new RoutingKey(tenantId, programId);
    }
}
