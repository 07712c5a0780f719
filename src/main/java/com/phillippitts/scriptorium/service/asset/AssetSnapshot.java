package com.phillippitts.scriptorium.service.asset;

import com.phillippitts.scriptorium.domain.TranscriptionStatus;

/**
 * Consistent point-in-time view of an {@link AssetStateMachine}.
 *
 * @param activeVersionId active version, or {@code null} before the first save
 * @param redoDepth       versions available to redo
 * @param redoOwner       editor who owns the redo path, or {@code null}
 */
public record AssetSnapshot(
        String assetId,
        TranscriptionStatus status,
        Long activeVersionId,
        int redoDepth,
        String redoOwner
) {
}
