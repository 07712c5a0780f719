package com.phillippitts.scriptorium.service.events;

import java.time.Instant;

/**
 * Published when a holder acquires a lease or renews one in place.
 */
public record ReservationObtainedEvent(
        String assetId,
        String holder,
        Instant expiresAt,
        boolean renewal
) {
}
