package com.sporetrack.controller.rest;

import com.sporetrack.core.model.SeriesCursor;
import com.sporetrack.core.model.SeriesSummary;
import com.sporetrack.service.core.series.SeriesPage;
import com.sporetrack.service.core.series.SeriesQueryService;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/series")
public class SeriesController {
    private final SeriesQueryService series;

    public SeriesController(SeriesQueryService series) {
        this.series = series;
    }

    @GetMapping
    public List<SeriesSummary> list(@RequestHeader(TenantHeaders.TENANT) UUID tenantId) {
        return series.listSeries(TenantHeaders.context(tenantId, null));
    }

    /** One page in phase-day order; pass the returned {@code nextCursor} as {@code after} to continue. */
    @GetMapping("/{programId}/{seriesCode}")
    public SeriesPage page(
            @RequestHeader(TenantHeaders.TENANT) UUID tenantId,
            @PathVariable UUID programId,
            @PathVariable String seriesCode,
            @RequestParam(required = false) String after,
            @RequestParam(defaultValue = "200") int limit) {
        SeriesCursor cursor = after == null || after.isBlank() ? null : SeriesCursor.parse(after);
        return series.page(TenantHeaders.context(tenantId, null), programId, seriesCode, cursor, limit);
    }
}
