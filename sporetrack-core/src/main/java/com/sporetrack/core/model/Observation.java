package com.sporetrack.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * The atomic unit of the store: one raw reading of one instrument, plus its derived fields.
 *
 * <p>{@code observedAt} is the authoritative capture time. It is set once at submission and every storage path
 * preserves it. {@code rawReading} may be null; such an observation is stored with
 * {@link DerivationStatus#PENDING_REPROCESSING}.
 */
public record Observation(
        UUID observationId,
        UUID tenantId,
        UUID programId,
        UUID siteId,
        UUID submissionId,
        String seriesCode,
        ReadingKind readingKind,
        int phaseDay,
        Instant observedAt,
        Double rawReading,
        DerivedMetrics derived,
        DerivationStatus derivationStatus,
        SyncState syncState,
        long revision,
        Instant updatedAt) {

    public Observation {
        Objects.requireNonNull(observationId, "observationId");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(programId, "programId");
        Objects.requireNonNull(seriesCode, "seriesCode");
        Objects.requireNonNull(readingKind, "readingKind");
        Objects.requireNonNull(observedAt, "observedAt");
        if (phaseDay < 1) {
            throw new IllegalArgumentException("phaseDay must be >= 1 but was " + phaseDay);
        }
        derived = derived != null ? derived : DerivedMetrics.undefined();
        derivationStatus = derivationStatus != null ? derivationStatus : DerivationStatus.PENDING_REPROCESSING;
        syncState = syncState != null ? syncState : SyncState.PENDING;
    }

    public SeriesKey seriesKey() {
        return new SeriesKey(tenantId, programId, siteId, seriesCode);
    }

    public RoutingKey routingKey() {
        return new RoutingKey(tenantId, programId);
    }

    public Observation withDerived(DerivedMetrics metrics, DerivationStatus status) {
        return toBuilder().derived(metrics).derivationStatus(status).build();
    }

    public Observation withSyncState(SyncState state) {
        return toBuilder().syncState(state).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .observationId(observationId)
                .tenantId(tenantId)
                .programId(programId)
                .siteId(siteId)
                .submissionId(submissionId)
                .seriesCode(seriesCode)
                .readingKind(readingKind)
                .phaseDay(phaseDay)
                .observedAt(observedAt)
                .rawReading(rawReading)
                .derived(derived)
                .derivationStatus(derivationStatus)
                .syncState(syncState)
                .revision(revision)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UUID observationId;
        private UUID tenantId;
        private UUID programId;
        private UUID siteId;
        private UUID submissionId;
        private String seriesCode;
        private ReadingKind readingKind;
        private int phaseDay = 1;
        private Instant observedAt;
        private Double rawReading;
        private DerivedMetrics derived;
        private DerivationStatus derivationStatus;
        private SyncState syncState;
        private long revision;
        private Instant updatedAt;

        private Builder() {}

        public Builder observationId(UUID v) {
            this.observationId = v;
            return this;
        }

        public Builder tenantId(UUID v) {
            this.tenantId = v;
            return this;
        }

        public Builder programId(UUID v) {
            this.programId = v;
            return this;
        }

        public Builder siteId(UUID v) {
            this.siteId = v;
            return this;
        }

        public Builder submissionId(UUID v) {
            this.submissionId = v;
            return this;
        }

        public Builder seriesCode(String v) {
            this.seriesCode = v;
            return this;
        }

        public Builder readingKind(ReadingKind v) {
            this.readingKind = v;
            return this;
        }

        public Builder phaseDay(int v) {
            this.phaseDay = v;
            return this;
        }

        public Builder observedAt(Instant v) {
            this.observedAt = v;
            return this;
        }

        public Builder rawReading(Double v) {
            this.rawReading = v;
            return this;
        }

        public Builder derived(DerivedMetrics v) {
            this.derived = v;
            return this;
        }

        public Builder derivationStatus(DerivationStatus v) {
            this.derivationStatus = v;
            return this;
        }

        public Builder syncState(SyncState v) {
            this.syncState = v;
            return this;
        }

        public Builder revision(long v) {
            this.revision = v;
            return this;
        }

        public Builder updatedAt(Instant v) {
            this.updatedAt = v;
            return this;
        }

        public Observation build() {
            return new Observation(
                    observationId,
                    tenantId,
                    programId,
                    siteId,
                    submissionId,
                    seriesCode,
                    readingKind,
                    phaseDay,
                    observedAt,
                    rawReading,
                    derived,
                    derivationStatus,
                    syncState,
                    revision,
                    updatedAt);
        }
    }
}
