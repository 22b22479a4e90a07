package com.sporetrack.service.core.series;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sporetrack.core.model.Observation;
import java.util.List;

/** One page of a series; {@code nextCursor} is null on the last page. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeriesPage(List<Observation> items, String nextCursor) {}
