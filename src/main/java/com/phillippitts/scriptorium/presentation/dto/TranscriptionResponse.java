package com.phillippitts.scriptorium.presentation.dto;

import com.phillippitts.scriptorium.service.review.TranscriptionOutcome;

/**
 * Result of save, submit, review, undo, redo and OCR.
 *
 * @param submitUrl where the author submits {@code versionId} for review
 */
public record TranscriptionResponse(
        long versionId,
        String assetId,
        String text,
        String status,
        String submitUrl,
        boolean undoAvailable,
        boolean redoAvailable,
        int contributorCount,
        boolean ocrGenerated,
        boolean ocrOriginated
) {
    public static TranscriptionResponse from(TranscriptionOutcome outcome) {
        var v = outcome.version();
        return new TranscriptionResponse(
                v.id(),
                v.assetId(),
                v.text(),
                outcome.status().wireName(),
                submitUrl(v.id()),
                outcome.undoAvailable(),
                outcome.redoAvailable(),
                outcome.contributorCount(),
                v.ocrGenerated(),
                v.ocrOriginated());
    }

    public static String submitUrl(long versionId) {
        return "/api/transcriptions/" + versionId + "/submit";
    }
}
