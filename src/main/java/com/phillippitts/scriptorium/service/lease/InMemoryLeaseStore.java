package com.phillippitts.scriptorium.service.lease;

import com.phillippitts.scriptorium.config.properties.ReservationProperties;
import com.phillippitts.scriptorium.domain.Lease;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local {@link LeaseStore} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Acquisition runs inside {@link ConcurrentMap#compute}, which serializes writers per asset.
 * No lease is ever extended beyond {@code acquiredAt + maxHold}. When such a capped lease lapses
 * it is moved to the tombstone map (inside the same {@code compute}), which refuses its holder
 * for {@code tombstoneLength} after the cap.
 */
@Component
public class InMemoryLeaseStore implements LeaseStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryLeaseStore.class);

    private final ConcurrentMap<String, Lease> leases = new ConcurrentHashMap<>();
    private final ConcurrentMap<Grave, Lease> tombstones = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration maxHold;
    private final Duration tombstoneLength;

    @Autowired
    public InMemoryLeaseStore(Clock clock, ReservationProperties props) {
        this(clock, props.getMaxHold(), props.getTombstoneLength());
    }

    InMemoryLeaseStore(Clock clock, Duration maxHold, Duration tombstoneLength) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxHold = Objects.requireNonNull(maxHold, "maxHold");
        this.tombstoneLength = Objects.requireNonNull(tombstoneLength, "tombstoneLength");
    }

    @Override
    public Optional<Lease> put(String assetId, String holder, Duration ttl) {
        Objects.requireNonNull(assetId, "assetId");
        Objects.requireNonNull(holder, "holder");
        Instant now = clock.instant();
        Lease[] stored = new Lease[1];
        leases.compute(assetId, (id, existing) -> {
            Lease current = existing;
            if (current != null && !current.isLiveAt(now) && current.hasReachedMaxHold(maxHold)) {
                entomb(current);
                current = null;
            }
            if (tombstoneInForce(id, holder, now)) {
                return current;
            }
            if (current != null && current.isLiveAt(now)) {
                if (!current.isHeldBy(holder)) {
                    return current;
                }
                Lease renewed = current.extendTo(capped(current.acquiredAt(), now.plus(ttl)));
                stored[0] = renewed;
                return renewed;
            }
            Lease fresh = new Lease(id, holder, now, capped(now, now.plus(ttl)));
            stored[0] = fresh;
            return fresh;
        });
        return Optional.ofNullable(stored[0]);
    }

    @Override
    public Optional<Lease> get(String assetId) {
        Instant now = clock.instant();
        return find(assetId).filter(lease -> lease.isLiveAt(now));
    }

    @Override
    public Optional<Lease> find(String assetId) {
        return Optional.ofNullable(leases.get(assetId));
    }

    @Override
    public void remove(String assetId) {
        leases.remove(assetId);
    }

    @Override
    public boolean remove(Lease expected) {
        return leases.remove(expected.assetId(), expected);
    }

    @Override
    public boolean isTombstoned(String assetId, String holder) {
        return tombstoneInForce(assetId, holder, clock.instant());
    }

    @Override
    public List<Lease> purgeExpiredBefore(Instant cutoff) {
        List<Lease> purged = new ArrayList<>();
        for (Lease lease : leases.values()) {
            if (!lease.expiresAt().isBefore(cutoff)) {
                continue;
            }
            boolean[] removed = new boolean[1];
            leases.computeIfPresent(lease.assetId(), (id, current) -> {
                if (!current.equals(lease)) {
                    return current;
                }
                if (current.hasReachedMaxHold(maxHold)) {
                    entomb(current);
                }
                removed[0] = true;
                return null;
            });
            if (removed[0]) {
                purged.add(lease);
            }
        }
        if (!purged.isEmpty()) {
            LOG.debug("Purged {} lapsed lease record(s) expired before {}", purged.size(), cutoff);
        }
        return purged;
    }

    @Override
    public int purgeTombstones() {
        Instant now = clock.instant();
        int dropped = 0;
        for (Lease tomb : tombstones.values()) {
            if (!isInForce(tomb, now) && tombstones.remove(Grave.of(tomb), tomb)) {
                dropped++;
            }
        }
        return dropped;
    }

    // Caller must be inside leases.compute for the same asset
    private void entomb(Lease lease) {
        tombstones.put(Grave.of(lease), lease);
        LOG.info("Lease on asset {} held by {} reached its maximum hold; holder locked out until {}",
                lease.assetId(), lease.holder(), lease.expiresAt().plus(tombstoneLength));
    }

    private boolean tombstoneInForce(String assetId, String holder, Instant now) {
        Lease tomb = tombstones.get(new Grave(assetId, holder));
        return tomb != null && isInForce(tomb, now);
    }

    private boolean isInForce(Lease tomb, Instant now) {
        return now.isBefore(tomb.expiresAt().plus(tombstoneLength));
    }

    private Instant capped(Instant acquiredAt, Instant candidate) {
        Instant cap = acquiredAt.plus(maxHold);
        return candidate.isAfter(cap) ? cap : candidate;
    }

    /** Tombstones are kept per holder: several editors may be locked out of one asset. */
    private record Grave(String assetId, String holder) {
        static Grave of(Lease lease) {
            return new Grave(lease.assetId(), lease.holder());
        }
    }
}
