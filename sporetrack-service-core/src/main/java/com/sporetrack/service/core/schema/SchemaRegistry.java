package com.sporetrack.service.core.schema;

import com.sporetrack.core.model.TenantContext;
import com.sporetrack.service.core.config.SporetrackProperties;
import com.sporetrack.service.core.partition.PartitionManager;
import com.sporetrack.service.core.schema.SchemaDescription.ColumnDescriptor;
import com.sporetrack.service.core.series.SeriesQueryService;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Versioned column catalog of the partitioned store, taken from configuration. The live database is never
 * introspected; an empty configured list means the built-in columns of version 1.
 */
@Component
public class SchemaRegistry {

    static final List<ColumnDescriptor> BUILT_IN = List.of(
            new ColumnDescriptor("observation_id", "uuid", false),
            new ColumnDescriptor("tenant_id", "uuid", false),
            new ColumnDescriptor("program_id", "uuid", false),
            new ColumnDescriptor("site_id", "uuid", false),
            new ColumnDescriptor("submission_id", "uuid", false),
            new ColumnDescriptor("series_code", "text", false),
            new ColumnDescriptor("reading_kind", "text", false),
            new ColumnDescriptor("phase_day", "integer", false),
            new ColumnDescriptor("observed_at", "timestamptz", false),
            new ColumnDescriptor("raw_reading", "double precision", false),
            new ColumnDescriptor("stage_category", "text", true),
            new ColumnDescriptor("progression", "double precision", true),
            new ColumnDescriptor("velocity", "double precision", true),
            new ColumnDescriptor("growth_trend", "text", true),
            new ColumnDescriptor("flow_rate", "double precision", true),
            new ColumnDescriptor("momentum", "double precision", true),
            new ColumnDescriptor("trend_category", "text", true),
            new ColumnDescriptor("forecasted_exhaustion_at", "timestamptz", true),
            new ColumnDescriptor("derivation_status", "text", false),
            new ColumnDescriptor("segment_id", "bigint", false));

    private final int version;
    private final List<ColumnDescriptor> columns;
    private final PartitionManager partitionManager;
    private final SeriesQueryService seriesQueryService;

    public SchemaRegistry(
            SporetrackProperties properties, PartitionManager partitionManager, SeriesQueryService seriesQueryService) {
        SporetrackProperties.Schema schema = properties.getSchema();
        this.version = schema.getVersion();
        this.columns = schema.getColumns().isEmpty()
                ? BUILT_IN
                : schema.getColumns().stream().map(SchemaRegistry::toDescriptor).toList();
        this.partitionManager = partitionManager;
        this.seriesQueryService = seriesQueryService;
    }

    public int version() {
        return version;
    }

    public List<ColumnDescriptor> columns() {
        return columns;
    }

    public SchemaDescription describeSchema(TenantContext ctx) {
        return new SchemaDescription(
                version, columns, partitionManager.listSegments(ctx), seriesQueryService.listSeries(ctx));
    }

    private static ColumnDescriptor toDescriptor(SporetrackProperties.Column column) {
        if (column.getName() == null || column.getName().isBlank()) {
            throw new IllegalStateException("sporetrack.schema.columns entries need a name");
        }
        String type = column.getType() != null ? column.getType().toLowerCase(Locale.ROOT) : "text";
        return new ColumnDescriptor(column.getName(), type, column.isDerived());
    }
}
