package com.phillippitts.scriptorium.client;

import com.phillippitts.scriptorium.domain.ReservationStatus;

/**
 * Editing-client view of the reservation endpoints.
 */
public interface ReservationClient {

    /**
     * Acquires or renews {@code holder}'s reservation on the asset.
     *
     * @throws ReservationTransportException if the server could not be reached or answered unexpectedly
     */
    ReservationStatus reserve(String assetId, String holder);

    /**
     * Releases {@code holder}'s reservation. The server treats this as idempotent.
     *
     * @throws ReservationTransportException if the request could not be delivered
     */
    void release(String assetId, String holder);
}
