package com.phillippitts.scriptorium.service.events;

import java.time.Instant;

/**
 * Published when a holder is told its reservation expired. {@code tombstoned} marks a holder locked
 * out after reaching the maximum hold, as opposed to one that merely missed renewals.
 */
public record ReservationExpiredEvent(
        String assetId,
        String holder,
        boolean tombstoned,
        Instant at
) {
}
