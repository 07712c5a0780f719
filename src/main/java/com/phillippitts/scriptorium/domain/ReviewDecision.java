package com.phillippitts.scriptorium.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Transition record for a review applied to an asset's active version. Not stored.
 */
public record ReviewDecision(
        long versionId,
        ReviewAction action,
        String reviewer,
        Instant decidedAt
) {
    public ReviewDecision {
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(reviewer, "reviewer must not be null");
        Objects.requireNonNull(decidedAt, "decidedAt must not be null");
    }
}
