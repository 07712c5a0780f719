package com.phillippitts.scriptorium.domain;

/**
 * Outcome of a reserve or renew request.
 */
public enum ReservationStatus {
    /** Caller holds a live lease (newly acquired or renewed in place). */
    GRANTED,
    /** A different holder owns a live lease, or the store could not be consulted. */
    CONFLICT,
    /** Caller's own previous lease lapsed; the caller should re-acquire. */
    EXPIRED
}
