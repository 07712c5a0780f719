package com.phillippitts.scriptorium.service.events;

import com.phillippitts.scriptorium.domain.TranscriptionStatus;

import java.time.Instant;

/**
 * Published after an asset's review status or active version changes.
 *
 * <p>PII note: carries no transcription text.
 */
public record TranscriptionStatusChangedEvent(
        String assetId,
        long versionId,
        TranscriptionStatus from,
        TranscriptionStatus to,
        String operation,
        String actor,
        Instant at
) {
}
