package com.sporetrack.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sporetrack.core.model.ReadingKind;
import com.sporetrack.core.model.SeriesTemplate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;
import java.util.UUID;
import lombok.Data;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
public class SubmitObservationRequest {

    @NotNull private UUID siteId;

    @NotNull private UUID programId;

    /** Groups the observations captured in one visit. */
    private UUID submissionId;

    /** Instrument or sample code, e.g. a petri or gasifier code. */
    @NotBlank
    private String seriesCode;

    @NotNull private ReadingKind readingKind;

    /** Optional; resolved from the program's phase calendar when absent. */
    @Positive
    private Integer phaseDay;

    /** May be null; the observation is then stored pending reprocessing. */
    private Double rawReading;

    /** Authoritative capture time. */
    @NotNull private Instant capturedAt;

    public SeriesTemplate toTemplate() {
        return new SeriesTemplate(siteId, programId, submissionId, seriesCode, readingKind, phaseDay);
    }
}
