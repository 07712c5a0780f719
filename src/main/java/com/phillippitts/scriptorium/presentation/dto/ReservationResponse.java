package com.phillippitts.scriptorium.presentation.dto;

import com.phillippitts.scriptorium.domain.Lease;
import com.phillippitts.scriptorium.domain.ReservationResult;

import java.time.Instant;

/**
 * Outcome of a reserve call. {@code holder} and {@code expiresAt} are set only when granted.
 */
public record ReservationResponse(
        String status,
        String holder,
        Instant expiresAt
) {
    public static ReservationResponse from(ReservationResult result) {
        String status = result.status().name().toLowerCase();
        Lease lease = result.lease();
        return lease == null
                ? new ReservationResponse(status, null, null)
                : new ReservationResponse(status, lease.holder(), lease.expiresAt());
    }
}
