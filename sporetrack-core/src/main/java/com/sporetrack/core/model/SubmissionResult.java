package com.sporetrack.core.model;

import java.util.UUID;

/**
 * Outcome of an accepted write. {@code derivationStatus} is {@link DerivationStatus#PENDING_REPROCESSING} when the
 * derived fields could not be computed yet; the raw observation is stored either way.
 */
public record SubmissionResult(UUID observationId, DerivationStatus derivationStatus, SyncState syncState) {}
