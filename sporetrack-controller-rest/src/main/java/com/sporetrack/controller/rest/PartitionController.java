package com.sporetrack.controller.rest;

import com.sporetrack.core.model.SegmentDescriptor;
import com.sporetrack.core.model.SegmentHandle;
import com.sporetrack.core.model.TenantContext;
import com.sporetrack.service.core.partition.PartitionManager;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/partitions")
public class PartitionController {
    private final PartitionManager partitions;

    public PartitionController(PartitionManager partitions) {
        this.partitions = partitions;
    }

    @GetMapping
    public List<SegmentDescriptor> list(@RequestHeader(TenantHeaders.TENANT) UUID tenantId) {
        return partitions.listSegments(TenantHeaders.context(tenantId, null));
    }

    @GetMapping("/{programId}")
    public SegmentDescriptor describe(
            @RequestHeader(TenantHeaders.TENANT) UUID tenantId, @PathVariable UUID programId) {
        return partitions.describe(TenantHeaders.context(tenantId, null), programId);
    }

    /** Called by program management when a program is registered. */
    @PostMapping("/{programId}")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> register(
            @RequestHeader(TenantHeaders.TENANT) UUID tenantId, @PathVariable UUID programId) {
        TenantContext ctx = TenantHeaders.context(tenantId, null);
        SegmentHandle handle = partitions.onProgramRegistered(ctx, programId);
        return Map.of("programId", programId, "segmentId", handle.segmentId());
    }
}
