package com.sporetrack.service.core.store;

import com.sporetrack.core.model.DerivationStatus;
import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.SyncState;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The canonical, append-mostly observation store. Implementations never change {@code observed_at} after insert.
 */
public interface CanonicalObservationRepository {

    void insert(Observation observation);

    /** Rewrites the mutable fields (reading, derived fields, states, revision). Identity and capture time stay. */
    void update(Observation observation);

    boolean delete(UUID tenantId, UUID observationId);

    Optional<Observation> findById(UUID tenantId, UUID observationId);

    /** Latest observation of the series on the given phase day. */
    Optional<Observation> findByPhaseDay(UUID tenantId, UUID programId, String seriesCode, int phaseDay);

    /** Capture time of the earliest observation of the series at or before {@code atOrBefore}. */
    Optional<Instant> findSeriesStart(UUID tenantId, UUID programId, String seriesCode, Instant atOrBefore);

    /** Whole series ordered by phase day, then capture time. */
    List<Observation> findSeries(UUID tenantId, UUID programId, String seriesCode);

    /** Rows strictly after {@code after} (or from the beginning when null) in {@link CanonicalPosition} order. */
    List<Observation> findAfter(CanonicalPosition after, int limit);

    /** Rows still flagged {@link DerivationStatus#PENDING_REPROCESSING} whose raw reading is now present. */
    List<Observation> findReprocessable(int limit);

    List<Observation> findBySyncState(SyncState state, int limit);

    long countBySyncState(SyncState state);

    void updateSyncState(UUID observationId, SyncState state);

    /** Serializes writers of one series until the surrounding transaction ends. */
    void lockSeries(UUID tenantId, UUID programId, String seriesCode);
}
