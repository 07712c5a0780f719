package com.phillippitts.scriptorium.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an asset's active transcription.
 *
 * <p><b>Transitions:</b>
 * <pre>
 * NOT_STARTED → IN_PROGRESS (save)
 * IN_PROGRESS → IN_PROGRESS (save, undo, redo)
 * IN_PROGRESS → SUBMITTED   (submit)
 * SUBMITTED   → COMPLETED   (accept)
 * SUBMITTED   → IN_PROGRESS (reject)
 * </pre>
 */
public enum TranscriptionStatus {
    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),
    SUBMITTED("submitted"),
    COMPLETED("completed");

    private final String wireName;

    TranscriptionStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Editable states accept saves, undo and redo from the lease holder. */
    public boolean isEditable() {
        return this == NOT_STARTED || this == IN_PROGRESS;
    }

    public boolean canTransitionTo(TranscriptionStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<TranscriptionStatus> allowedTargets() {
        return switch (this) {
            case NOT_STARTED -> EnumSet.of(IN_PROGRESS);
            case IN_PROGRESS -> EnumSet.of(IN_PROGRESS, SUBMITTED);
            case SUBMITTED -> EnumSet.of(COMPLETED, IN_PROGRESS);
            case COMPLETED -> EnumSet.noneOf(TranscriptionStatus.class);
        };
    }
}
