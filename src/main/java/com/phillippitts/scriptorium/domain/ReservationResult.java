package com.phillippitts.scriptorium.domain;

import java.util.Objects;

/**
 * Result of {@code reserve}. {@code lease} is present only when {@link ReservationStatus#GRANTED}.
 */
public record ReservationResult(ReservationStatus status, Lease lease) {

    public ReservationResult {
        Objects.requireNonNull(status, "status must not be null");
        if (status == ReservationStatus.GRANTED && lease == null) {
            throw new IllegalArgumentException("granted reservation requires a lease");
        }
    }

    public static ReservationResult granted(Lease lease) {
        return new ReservationResult(ReservationStatus.GRANTED, lease);
    }

    public static ReservationResult conflict() {
        return new ReservationResult(ReservationStatus.CONFLICT, null);
    }

    public static ReservationResult expired() {
        return new ReservationResult(ReservationStatus.EXPIRED, null);
    }

    public boolean isGranted() {
        return status == ReservationStatus.GRANTED;
    }
}
