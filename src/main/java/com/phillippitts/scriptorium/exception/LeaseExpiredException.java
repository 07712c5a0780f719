package com.phillippitts.scriptorium.exception;

/**
 * Thrown when the caller's own lease lapsed because renewals stopped arriving.
 * Clients respond by re-acquiring the reservation.
 */
public class LeaseExpiredException extends ScriptoriumException {

    private final String assetId;
    private final String holder;

    public LeaseExpiredException(String assetId, String holder) {
        super("Reservation on asset " + assetId + " held by " + holder + " has expired");
        this.assetId = assetId;
        this.holder = holder;
    }

    public String getAssetId() {
        return assetId;
    }

    public String getHolder() {
        return holder;
    }
}
