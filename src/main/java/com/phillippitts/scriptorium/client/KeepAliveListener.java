package com.phillippitts.scriptorium.client;

/**
 * Callbacks from a {@link KeepAliveLoop}. Invoked on the scheduler thread; implementations should
 * return quickly.
 */
public interface KeepAliveListener {

    /** Reservation acquired or renewed. */
    void onGranted(String assetId);

    /** The lease had lapsed and was acquired again; the editor may keep working. */
    void onReacquired(String assetId);

    /** Another editor holds the asset. The loop has stopped; lock the editor read-only. */
    void onConflict(String assetId);

    /** A renewal could not be delivered. The loop retries on its next tick. */
    void onTransientFailure(String assetId, ReservationTransportException cause);
}
