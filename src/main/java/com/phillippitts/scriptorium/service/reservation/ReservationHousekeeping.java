package com.phillippitts.scriptorium.service.reservation;

import com.phillippitts.scriptorium.config.properties.ReservationProperties;
import com.phillippitts.scriptorium.domain.Lease;
import com.phillippitts.scriptorium.exception.StoreUnavailableException;
import com.phillippitts.scriptorium.service.events.ReservationReleasedEvent;
import com.phillippitts.scriptorium.service.lease.LeaseStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Periodically deletes lease records that lapsed more than {@code purge-grace} ago, and tombstones
 * whose lock-out has run its course. A purged record that reached its maximum hold becomes a
 * tombstone rather than disappearing.
 *
 * <p>Purging is storage hygiene only: readers already treat lapsed leases as absent.
 * The grace period keeps a recently lapsed record around long enough for its holder
 * to be told EXPIRED rather than silently re-granted.
 */
@Component
class ReservationHousekeeping {

    private static final Logger LOG = LogManager.getLogger(ReservationHousekeeping.class);

    private final LeaseStore store;
    private final ReservationProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    ReservationHousekeeping(LeaseStore store,
                            ReservationProperties props,
                            ApplicationEventPublisher publisher,
                            Clock clock) {
        this.store = store;
        this.props = props;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${scriptorium.reservation.housekeeping-interval:PT60S}")
    void purgeLapsedLeases() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(props.getPurgeGrace());
        List<Lease> purged;
        int tombstones;
        try {
            purged = store.purgeExpiredBefore(cutoff);
            tombstones = store.purgeTombstones();
        } catch (StoreUnavailableException e) {
            // next sweep retries
            LOG.warn("Lease housekeeping skipped: {}", e.getMessage());
            return;
        }
        for (Lease lease : purged) {
            publisher.publishEvent(new ReservationReleasedEvent(
                    lease.assetId(), lease.holder(), ReservationReleasedEvent.Reason.PURGED, now));
        }
        if (!purged.isEmpty()) {
            LOG.info("Housekeeping purged {} lapsed reservation(s)", purged.size());
        }
        if (tombstones > 0) {
            LOG.debug("Housekeeping dropped {} tombstone(s)", tombstones);
        }
    }
}
