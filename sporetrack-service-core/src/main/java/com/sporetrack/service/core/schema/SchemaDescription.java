package com.sporetrack.service.core.schema;

import com.sporetrack.core.model.SegmentDescriptor;
import com.sporetrack.core.model.SeriesSummary;
import java.util.List;

/** What the reporting layer may query: schema version, columns, the caller's segments and series. */
public record SchemaDescription(
        int version, List<ColumnDescriptor> columns, List<SegmentDescriptor> segments, List<SeriesSummary> series) {

    public record ColumnDescriptor(String name, String type, boolean derived) {}
}
