package com.sporetrack.service.core.series;

import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.RoutingKey;
import com.sporetrack.core.model.SeriesCursor;
import com.sporetrack.core.model.SeriesSummary;
import com.sporetrack.core.model.TenantContext;
import com.sporetrack.service.core.partition.PartitionManager;
import com.sporetrack.service.core.store.PartitionedObservationRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Partition-pruned reads of the partitioned store. A series read only touches the default segment and the
 * program's own segment.
 */
@Service
@RequiredArgsConstructor
public class SeriesQueryService {

    static final int DEFAULT_PAGE_SIZE = 200;
    static final int MAX_PAGE_SIZE = 1000;

    private final PartitionManager partitionManager;
    private final PartitionedObservationRepository partitions;

    public ObservationSeries getSeries(TenantContext ctx, String seriesCode, UUID programId) {
        RoutingKey key = new RoutingKey(ctx.tenantId(), programId);
        String code = requireSeriesCode(seriesCode);
        return new ObservationSeries(
                (after, limit) -> partitions.findSeriesPage(
                        ctx.tenantId(), programId, code, partitionManager.readSegments(key), after, limit),
                null,
                DEFAULT_PAGE_SIZE);
    }

    public SeriesPage page(TenantContext ctx, UUID programId, String seriesCode, SeriesCursor after, int limit) {
        int size = Math.min(Math.max(1, limit), MAX_PAGE_SIZE);
        RoutingKey key = new RoutingKey(ctx.tenantId(), programId);
        // one extra row tells whether another page exists
        List<Observation> rows = partitions.findSeriesPage(
                ctx.tenantId(), programId, requireSeriesCode(seriesCode), partitionManager.readSegments(key), after, size + 1);
        if (rows.size() <= size) {
            return new SeriesPage(rows, null);
        }
        List<Observation> items = rows.subList(0, size);
        return new SeriesPage(List.copyOf(items), SeriesCursor.after(items.get(size - 1)).toString());
    }

    public List<SeriesSummary> listSeries(TenantContext ctx) {
        return partitions.listSeries(ctx.tenantId());
    }

    private static String requireSeriesCode(String seriesCode) {
        if (seriesCode == null || seriesCode.isBlank()) {
            throw new IllegalArgumentException("seriesCode is required");
        }
        return seriesCode.trim();
    }
}
