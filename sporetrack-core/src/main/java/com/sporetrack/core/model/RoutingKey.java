package com.sporetrack.core.model;

import java.util.Objects;
import java.util.UUID;

/** Partition routing key. Program is the primary key; tenant scope travels with it. */
public record RoutingKey(UUID tenantId, UUID programId) {

    public RoutingKey {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(programId, "programId");
    }
}
