package com.sporetrack.service.core.store;

import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.RoutingKey;
import com.sporetrack.core.model.SeriesCursor;
import com.sporetrack.core.model.SeriesSummary;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Physically segmented read store. Rows are identified by ({@code observation_id}, {@code program_id}). */
public interface PartitionedObservationRepository {

    enum UpsertResult {
        INSERTED,
        UPDATED
    }

    /** Creates the physical storage of a segment if it does not exist yet. Safe to call concurrently. */
    void provisionSegment(long segmentId);

    /**
     * Detaches the segment so no further write can reach it, then drops it when it holds no rows. A segment that
     * received rows is attached again and kept.
     *
     * @return true when the segment was dropped
     */
    boolean dropSegmentIfEmpty(long segmentId);

    /**
     * Inserts the row into {@code segmentId} or, when the identity already exists anywhere, rewrites every field
     * except {@code observed_at} and moves it to {@code segmentId}.
     */
    UpsertResult upsert(long segmentId, Observation replica);

    boolean delete(UUID observationId, UUID programId);

    Optional<PartitionedRow> find(UUID observationId, UUID programId);

    /** One page of a series from the given segments only, ordered by (phase day, observation id). */
    List<Observation> findSeriesPage(
            UUID tenantId,
            UUID programId,
            String seriesCode,
            Collection<Long> segmentIds,
            SeriesCursor after,
            int limit);

    List<SeriesSummary> listSeries(UUID tenantId);

    long countRows(long segmentId);

    /** Routing keys that currently have rows in the segment. */
    List<RoutingKey> routingKeysIn(long segmentId);

    /** Moves up to {@code limit} rows of one routing key between segments; returns how many moved. */
    int reassign(RoutingKey key, long fromSegment, long toSegment, int limit);

    /** Refreshes planner statistics of a segment. Must not block readers or writers. */
    void analyze(long segmentId);
}
