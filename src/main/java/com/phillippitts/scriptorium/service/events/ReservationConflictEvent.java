package com.phillippitts.scriptorium.service.events;

/**
 * Published when a reservation request is refused. {@code failedClosed} marks refusals caused by
 * an unreachable lease store rather than a competing holder.
 */
public record ReservationConflictEvent(
        String assetId,
        String requester,
        boolean failedClosed
) {
}
