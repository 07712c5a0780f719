package com.phillippitts.scriptorium.service.events;

import java.time.Instant;

/**
 * Published when a lease is removed, whatever the cause.
 */
public record ReservationReleasedEvent(
        String assetId,
        String holder,
        Reason reason,
        Instant at
) {
    public enum Reason {
        /** Holder released it, e.g. on page unload. */
        RELEASED,
        /** The asset's transcription was accepted; no further edits expected. */
        COMPLETED,
        /** Holder's lapsed lease was reclaimed when it next called in. */
        EXPIRED,
        /** Housekeeping removed a lease that lapsed long ago. */
        PURGED
    }
}
