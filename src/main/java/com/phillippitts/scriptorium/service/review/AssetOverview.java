package com.phillippitts.scriptorium.service.review;

import com.phillippitts.scriptorium.domain.Lease;
import com.phillippitts.scriptorium.domain.TranscriptionStatus;
import com.phillippitts.scriptorium.domain.TranscriptionVersion;

import java.util.Optional;

/**
 * Read-only view of an asset for the editing page.
 *
 * @param activeVersion active version, if any has been saved
 * @param lease         live reservation, if any
 */
public record AssetOverview(
        String assetId,
        TranscriptionStatus status,
        Optional<TranscriptionVersion> activeVersion,
        Optional<Lease> lease,
        boolean undoAvailable,
        boolean redoAvailable,
        int contributorCount
) {
}
