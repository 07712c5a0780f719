package com.phillippitts.scriptorium.exception;

/**
 * Thrown when another editor holds a live lease on the asset, or when the lease store
 * cannot be consulted (reservations fail closed).
 */
public class ReservationConflictException extends ScriptoriumException {

    private final String assetId;

    public ReservationConflictException(String assetId) {
        super("Asset " + assetId + " is reserved by another editor");
        this.assetId = assetId;
    }

    public ReservationConflictException(String assetId, Throwable cause) {
        super("Reservation state for asset " + assetId + " could not be verified", cause);
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }
}
