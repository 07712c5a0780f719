package com.phillippitts.scriptorium.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of the transcribed text of one asset.
 *
 * <p>Versions form a backward-linked chain through {@link #supersedes()}. Once written, only the
 * submission and review stamps may change, and each change produces a new record with the same id
 * that replaces the stored one.
 *
 * <p>Empty text is valid: it records that the page has nothing to transcribe.
 *
 * @param id            store-assigned identifier, unique across assets and increasing
 * @param assetId       asset this version belongs to
 * @param text          full transcription text (never null, may be empty)
 * @param author        identity of the editor who wrote this version
 * @param createdAt     creation time
 * @param supersedes    id of the (older) version this one replaces, or {@code null} for the first version
 * @param submittedAt   when the author submitted it for review, or {@code null}
 * @param acceptedAt    when a reviewer accepted it, or {@code null}
 * @param rejectedAt    when a reviewer rejected it, or {@code null}
 * @param reviewer      identity of the reviewer, or {@code null}
 * @param ocrGenerated  text was produced directly by the OCR engine
 * @param ocrOriginated text descends from an OCR-produced version
 */
public record TranscriptionVersion(
        long id,
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

    public TranscriptionVersion {
        Objects.requireNonNull(assetId, "assetId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(author, "author must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (supersedes != null && supersedes >= id) {
            throw new IllegalArgumentException(
                    "A version may only supersede an older version: " + id + " -> " + supersedes);
        }
        if (acceptedAt != null && rejectedAt != null) {
            throw new IllegalArgumentException("A version cannot be both accepted and rejected");
        }
        if (acceptedAt != null && author.equals(reviewer)) {
            throw new IllegalArgumentException("A version cannot be accepted by its own author");
        }
    }

    /** Pending review: submitted and not yet accepted or rejected. */
    public boolean isAwaitingReview() {
        return submittedAt != null && acceptedAt == null && rejectedAt == null;
    }

    public boolean isOcrDerived() {
        return ocrGenerated || ocrOriginated;
    }

    /** Stamps a (re)submission, clearing any earlier rejection. */
    public TranscriptionVersion submitted(Instant at) {
        return new TranscriptionVersion(id, assetId, text, author, createdAt, supersedes,
                at, null, null, null, ocrGenerated, ocrOriginated);
    }

    public TranscriptionVersion accepted(String by, Instant at) {
        return new TranscriptionVersion(id, assetId, text, author, createdAt, supersedes,
                submittedAt, at, null, by, ocrGenerated, ocrOriginated);
    }

    public TranscriptionVersion rejected(String by, Instant at) {
        return new TranscriptionVersion(id, assetId, text, author, createdAt, supersedes,
                submittedAt, null, at, by, ocrGenerated, ocrOriginated);
    }
}
