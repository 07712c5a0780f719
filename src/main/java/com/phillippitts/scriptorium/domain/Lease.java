package com.phillippitts.scriptorium.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Exclusive, time-bounded permission for one holder to edit one asset.
 *
 * <p>A lease is live while {@code now} is strictly before {@link #expiresAt()}.
 * Lapsed leases may still be stored; readers treat them as absent.
 *
 * @param assetId    asset being edited
 * @param holder     identity of the editor holding the lease
 * @param acquiredAt when the holder first obtained the lease (unchanged by renewal)
 * @param expiresAt  when the lease lapses absent a further renewal
 */
public record Lease(
        String assetId,
        String holder,
        Instant acquiredAt,
        Instant expiresAt
) {

    public Lease {
        Objects.requireNonNull(assetId, "assetId must not be null");
        Objects.requireNonNull(holder, "holder must not be null");
        Objects.requireNonNull(acquiredAt, "acquiredAt must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        if (expiresAt.isBefore(acquiredAt)) {
            throw new IllegalArgumentException("expiresAt must not precede acquiredAt");
        }
    }

    public boolean isLiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    /**
     * Whether the lease has been renewed up to its absolute cap of {@code acquiredAt + maxHold}.
     * Such a lease can never be renewed again.
     */
    public boolean hasReachedMaxHold(Duration maxHold) {
        return !expiresAt.isBefore(acquiredAt.plus(maxHold));
    }

    public boolean isHeldBy(String candidate) {
        return holder.equals(candidate);
    }

    /**
     * Returns a copy whose expiry is moved to {@code newExpiry} if that is later.
     * Renewal never shortens a lease.
     */
    public Lease extendTo(Instant newExpiry) {
        if (!newExpiry.isAfter(expiresAt)) {
            return this;
        }
        return new Lease(assetId, holder, acquiredAt, newExpiry);
    }
}
