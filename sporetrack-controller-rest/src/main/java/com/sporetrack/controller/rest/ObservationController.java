package com.sporetrack.controller.rest;

import com.sporetrack.api.dto.AmendReadingRequest;
import com.sporetrack.api.dto.SubmitObservationRequest;
import com.sporetrack.core.model.SubmissionResult;
import com.sporetrack.service.core.spi.ObservationIngestService;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/observations")
public class ObservationController {
    private final ObservationIngestService ingest;

    public ObservationController(ObservationIngestService ingest) {
        this.ingest = ingest;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SubmissionResult submit(
            @RequestHeader(TenantHeaders.TENANT) UUID tenantId,
            @RequestHeader(value = TenantHeaders.PRINCIPAL, required = false) String principal,
            @Valid @RequestBody SubmitObservationRequest request) {
        return ingest.submit(
                TenantHeaders.context(tenantId, principal),
                request.toTemplate(),
                request.getRawReading(),
                request.getCapturedAt());
    }

    @PutMapping("/{observationId}/reading")
    public SubmissionResult amend(
            @RequestHeader(TenantHeaders.TENANT) UUID tenantId,
            @RequestHeader(value = TenantHeaders.PRINCIPAL, required = false) String principal,
            @PathVariable UUID observationId,
            @RequestBody AmendReadingRequest request) {
        return ingest.amend(TenantHeaders.context(tenantId, principal), observationId, request.getRawReading());
    }

    @DeleteMapping("/{observationId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
            @RequestHeader(TenantHeaders.TENANT) UUID tenantId,
            @RequestHeader(value = TenantHeaders.PRINCIPAL, required = false) String principal,
            @PathVariable UUID observationId) {
        ingest.delete(TenantHeaders.context(tenantId, principal), observationId);
    }
}
