package com.sporetrack.service.core.store;

import com.sporetrack.core.model.Observation;

public record PartitionedRow(long segmentId, Observation observation) {}
