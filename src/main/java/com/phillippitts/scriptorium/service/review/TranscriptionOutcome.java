package com.phillippitts.scriptorium.service.review;

import com.phillippitts.scriptorium.domain.TranscriptionStatus;
import com.phillippitts.scriptorium.domain.TranscriptionVersion;

/**
 * Result of a workflow operation: the version now relevant to the caller and the asset's state after
 * the operation.
 *
 * @param version          the new active version (save, OCR, undo, redo) or the version acted on
 *                         (submit, review)
 * @param status           asset status after the operation
 * @param undoAvailable    active version has a predecessor and the asset is editable
 * @param redoAvailable    the caller can redo an earlier undo
 * @param contributorCount distinct authors and reviewers of the asset
 */
public record TranscriptionOutcome(
        TranscriptionVersion version,
        TranscriptionStatus status,
        boolean undoAvailable,
        boolean redoAvailable,
        int contributorCount
) {
}
