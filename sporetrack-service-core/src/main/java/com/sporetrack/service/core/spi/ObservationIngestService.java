package com.sporetrack.service.core.spi;

import com.sporetrack.core.model.SeriesTemplate;
import com.sporetrack.core.model.SubmissionResult;
import com.sporetrack.core.model.TenantContext;
import java.time.Instant;
import java.util.UUID;

/** Write path of the store. Each call is one atomic unit of work per observation. */
public interface ObservationIngestService {

    /**
     * @param rawReading may be null; the observation is then stored pending reprocessing
     * @param capturedAt authoritative capture time, kept unchanged by every later write
     */
    SubmissionResult submit(TenantContext ctx, SeriesTemplate template, Double rawReading, Instant capturedAt);

    /** Replaces the raw reading of an existing observation and re-derives it and its successor. */
    SubmissionResult amend(TenantContext ctx, UUID observationId, Double rawReading);

    void delete(TenantContext ctx, UUID observationId);

    /**
     * @return number of observations whose derived fields were recomputed
     */
    int reprocessPending(int limit);
}
