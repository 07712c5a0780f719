package com.phillippitts.scriptorium.service.reservation;

import com.phillippitts.scriptorium.config.properties.ReservationProperties;
import com.phillippitts.scriptorium.domain.Lease;
import com.phillippitts.scriptorium.domain.ReservationResult;
import com.phillippitts.scriptorium.exception.LeaseExpiredException;
import com.phillippitts.scriptorium.exception.NotAuthorizedException;
import com.phillippitts.scriptorium.exception.ReservationConflictException;
import com.phillippitts.scriptorium.exception.StoreUnavailableException;
import com.phillippitts.scriptorium.service.events.ReservationConflictEvent;
import com.phillippitts.scriptorium.service.events.ReservationExpiredEvent;
import com.phillippitts.scriptorium.service.events.ReservationObtainedEvent;
import com.phillippitts.scriptorium.service.events.ReservationReleasedEvent;
import com.phillippitts.scriptorium.service.lease.LeaseStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Arbitrates concurrent editors of the same asset through renewable leases.
 *
 * <p><b>Outcomes of {@link #reserve}:</b>
 * <ul>
 *   <li>GRANTED: no live lease exists, or the caller already holds it (renewed in place)</li>
 *   <li>CONFLICT: another holder owns a live lease, or the lease store is unreachable</li>
 *   <li>EXPIRED: the caller's own lease lapsed; the stale record is reclaimed so the next
 *       reserve re-acquires normally. A holder whose lease reached {@code max-hold} is instead
 *       tombstoned and keeps getting EXPIRED for {@code tombstone-length}, while others may
 *       acquire the asset</li>
 * </ul>
 *
 * <p>The store is never bypassed: if it cannot be consulted the request fails closed.
 */
@Service
public class ReservationManager {

    private static final Logger LOG = LogManager.getLogger(ReservationManager.class);

    private final LeaseStore store;
    private final ReservationProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public ReservationManager(LeaseStore store,
                              ReservationProperties props,
                              ApplicationEventPublisher publisher,
                              Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Acquires or renews the caller's lease on an asset.
     *
     * @param assetId asset to edit
     * @param holder  identity of the editor
     * @return outcome, with the lease when granted
     */
    public ReservationResult reserve(String assetId, String holder) {
        requireText(assetId, "assetId");
        requireText(holder, "holder");
        try {
            Instant now = clock.instant();
            Optional<Lease> lapsed = ownLapsedLease(assetId, holder, now);
            if (lapsed.isPresent() && !lapsed.get().hasReachedMaxHold(props.getMaxHold())) {
                reclaim(lapsed.get(), now);
                return expired(assetId, holder, false, now);
            }
            Optional<Lease> previous = store.get(assetId);
            Optional<Lease> granted = store.put(assetId, holder, props.getTtl());
            if (granted.isEmpty()) {
                if (isTombstoned(assetId, holder)) {
                    return expired(assetId, holder, true, now);
                }
                LOG.debug("Reservation conflict on asset {} for {}", assetId, holder);
                publisher.publishEvent(new ReservationConflictEvent(assetId, holder, false));
                return ReservationResult.conflict();
            }
            Lease lease = granted.get();
            boolean renewal = previous.isPresent() && previous.get().isHeldBy(holder);
            publisher.publishEvent(new ReservationObtainedEvent(assetId, holder, lease.expiresAt(), renewal));
            return ReservationResult.granted(lease);
        } catch (StoreUnavailableException e) {
            LOG.error("Lease store unavailable while reserving asset {}; refusing reservation", assetId, e);
            publisher.publishEvent(new ReservationConflictEvent(assetId, holder, true));
            return ReservationResult.conflict();
        }
    }

    /**
     * Releases the caller's lease. Idempotent: does nothing unless {@code holder} owns the
     * stored record.
     *
     * @return {@code true} if a lease was removed
     */
    public boolean release(String assetId, String holder) {
        requireText(assetId, "assetId");
        requireText(holder, "holder");
        Optional<Lease> current = store.find(assetId);
        if (current.isEmpty() || !current.get().isHeldBy(holder)) {
            LOG.debug("Release ignored: asset {} not held by {}", assetId, holder);
            return false;
        }
        boolean removed = store.remove(current.get());
        if (removed) {
            publisher.publishEvent(new ReservationReleasedEvent(
                    assetId, holder, ReservationReleasedEvent.Reason.RELEASED, clock.instant()));
        }
        return removed;
    }

    /**
     * Removes any lease on the asset regardless of holder, e.g. once its transcription is completed.
     */
    public void releaseAll(String assetId, ReservationReleasedEvent.Reason reason) {
        Optional<Lease> current = store.find(assetId);
        store.remove(assetId);
        current.ifPresent(lease -> publisher.publishEvent(
                new ReservationReleasedEvent(assetId, lease.holder(), reason, clock.instant())));
    }

    /**
     * Live lease on the asset, if any. Store failures surface as {@link StoreUnavailableException}.
     */
    public Optional<Lease> currentLease(String assetId) {
        return store.get(assetId);
    }

    /**
     * Verifies that {@code holder} owns a live lease on the asset before a lease-gated mutation.
     *
     * @return the caller's live lease
     * @throws LeaseExpiredException        if the caller's own lease lapsed (reclaimed as a side effect)
     * @throws ReservationConflictException if another editor holds it, or the store is unreachable
     * @throws NotAuthorizedException       if nobody holds a lease on the asset
     */
    public Lease requireLease(String assetId, String holder) {
        try {
            Optional<Lease> live = store.get(assetId);
            if (live.isPresent() && live.get().isHeldBy(holder)) {
                return live.get();
            }
            if (isTombstoned(assetId, holder)) {
                throw new LeaseExpiredException(assetId, holder);
            }
            if (live.isPresent()) {
                throw new ReservationConflictException(assetId);
            }
            Instant now = clock.instant();
            Optional<Lease> lapsed = ownLapsedLease(assetId, holder, now);
            if (lapsed.isPresent()) {
                // a capped record stays for the next reserve to tombstone
                if (!lapsed.get().hasReachedMaxHold(props.getMaxHold())) {
                    reclaim(lapsed.get(), now);
                }
                throw new LeaseExpiredException(assetId, holder);
            }
            throw new NotAuthorizedException(holder, "A reservation is required to edit asset " + assetId);
        } catch (StoreUnavailableException e) {
            LOG.error("Lease store unavailable while verifying lease on asset {}", assetId, e);
            throw new ReservationConflictException(assetId, e);
        }
    }

    private Optional<Lease> ownLapsedLease(String assetId, String holder, Instant now) {
        return store.find(assetId).filter(lease -> !lease.isLiveAt(now) && lease.isHeldBy(holder));
    }

    private boolean isTombstoned(String assetId, String holder) {
        return store.isTombstoned(assetId, holder);
    }

    /**
     * Removes the caller's lapsed record so that EXPIRED is reported once per lapse.
     */
    private void reclaim(Lease lease, Instant now) {
        if (store.remove(lease)) {
            LOG.info("Lease on asset {} held by {} lapsed at {}", lease.assetId(), lease.holder(), lease.expiresAt());
            publisher.publishEvent(new ReservationReleasedEvent(
                    lease.assetId(), lease.holder(), ReservationReleasedEvent.Reason.EXPIRED, now));
        }
    }

    private ReservationResult expired(String assetId, String holder, boolean tombstoned, Instant now) {
        publisher.publishEvent(new ReservationExpiredEvent(assetId, holder, tombstoned, now));
        return ReservationResult.expired();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
