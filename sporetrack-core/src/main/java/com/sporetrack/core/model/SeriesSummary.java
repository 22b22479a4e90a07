package com.sporetrack.core.model;

import java.util.UUID;

public record SeriesSummary(
        UUID programId, String seriesCode, ReadingKind readingKind, long observationCount, int lastPhaseDay) {}
