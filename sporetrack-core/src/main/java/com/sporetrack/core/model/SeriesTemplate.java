package com.sporetrack.core.model;

import java.util.UUID;

/**
 * Per-observation template of a submission: where the reading was captured and which instrument it
 * belongs to. {@code phaseDay} is optional; when absent it is resolved from the program's phase calendar.
 */
public record SeriesTemplate(
        UUID siteId,
        UUID programId,
        UUID submissionId,
        String seriesCode,
        ReadingKind readingKind,
        Integer phaseDay) {}
