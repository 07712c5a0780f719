package com.phillippitts.scriptorium.service.lease;

import com.phillippitts.scriptorium.domain.Lease;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable mapping from asset to its current lease.
 *
 * <p>Expiry is computed on read, never actively enforced: a stored lease whose
 * {@code expiresAt} has passed is treated as absent by {@link #get(String)} and {@link #put}.
 * Lapsed records remain visible through {@link #find(String)} until removed or purged.
 *
 * <p>A lease renewed up to its maximum hold is <em>tombstoned</em> when it lapses: the record
 * moves aside and locks its former holder out for the tombstone length, while any other holder
 * may acquire the asset.
 *
 * <p>Implementations must make {@link #put} an atomic compare-and-set per asset.
 * Any method may throw {@link com.phillippitts.scriptorium.exception.StoreUnavailableException}.
 */
public interface LeaseStore {

    /**
     * Acquires or renews the lease on {@code assetId} for {@code holder}.
     *
     * <ul>
     *   <li>No record, or only a lapsed one: a fresh lease is stored.</li>
     *   <li>Live lease of the same holder: expiry is extended in place, never shortened.</li>
     *   <li>Live lease of another holder: nothing changes and empty is returned.</li>
     *   <li>Caller is tombstoned on the asset: nothing is granted and empty is returned.</li>
     * </ul>
     *
     * <p>A lapsed record that reached its maximum hold is tombstoned before anything else happens.
     *
     * @return the stored lease, or empty if another holder owns a live lease or the caller is tombstoned
     */
    Optional<Lease> put(String assetId, String holder, Duration ttl);

    /** Live lease on the asset, if any. */
    Optional<Lease> get(String assetId);

    /** Stored record on the asset including a lapsed one. */
    Optional<Lease> find(String assetId);

    /** Removes whatever record the asset has. */
    void remove(String assetId);

    /**
     * Removes the record only if it is exactly {@code expected}.
     *
     * @return {@code true} if the record was removed
     */
    boolean remove(Lease expected);

    /** Whether {@code holder} is locked out of the asset by a tombstone still in force. */
    boolean isTombstoned(String assetId, String holder);

    /**
     * Removes lapsed records whose expiry lies before {@code cutoff}. Records that reached their
     * maximum hold are tombstoned instead of dropped; they are still returned.
     *
     * @return the records no longer held as leases
     */
    List<Lease> purgeExpiredBefore(Instant cutoff);

    /**
     * Drops tombstones that are no longer in force.
     *
     * @return number of tombstones dropped
     */
    int purgeTombstones();
}
