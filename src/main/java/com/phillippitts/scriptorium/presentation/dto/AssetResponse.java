package com.phillippitts.scriptorium.presentation.dto;

import com.phillippitts.scriptorium.service.review.AssetOverview;

import java.time.Instant;

/**
 * Asset state for the editing page.
 *
 * @param activeVersion  active version, or {@code null} before the first save
 * @param reservedBy     holder of a live reservation, or {@code null}
 * @param reservedUntil  expiry of that reservation, or {@code null}
 */
public record AssetResponse(
        String assetId,
        String status,
        VersionResponse activeVersion,
        String reservedBy,
        Instant reservedUntil,
        boolean undoAvailable,
        boolean redoAvailable,
        int contributorCount
) {
    public static AssetResponse from(AssetOverview overview) {
        return new AssetResponse(
                overview.assetId(),
                overview.status().wireName(),
                overview.activeVersion().map(VersionResponse::from).orElse(null),
                overview.lease().map(l -> l.holder()).orElse(null),
                overview.lease().map(l -> l.expiresAt()).orElse(null),
                overview.undoAvailable(),
                overview.redoAvailable(),
                overview.contributorCount());
    }
}
