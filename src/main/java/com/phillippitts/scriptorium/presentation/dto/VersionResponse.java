package com.phillippitts.scriptorium.presentation.dto;

import com.phillippitts.scriptorium.domain.TranscriptionVersion;

import java.time.Instant;

/**
 * One stored transcription version.
 */
public record VersionResponse(
        long versionId,
        String assetId,
        String text,
        String author,
        Instant createdAt,
        Long supersedes,
        Instant submittedAt,
        Instant acceptedAt,
        Instant rejectedAt,
        String reviewer,
        boolean ocrGenerated,
        boolean ocrOriginated
) {
    public static VersionResponse from(TranscriptionVersion v) {
        return new VersionResponse(v.id(), v.assetId(), v.text(), v.author(), v.createdAt(),
                v.supersedes(), v.submittedAt(), v.acceptedAt(), v.rejectedAt(), v.reviewer(),
                v.ocrGenerated(), v.ocrOriginated());
    }
}
