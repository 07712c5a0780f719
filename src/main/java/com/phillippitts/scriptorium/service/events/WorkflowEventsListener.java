package com.phillippitts.scriptorium.service.events;

import com.phillippitts.scriptorium.service.metrics.WorkflowMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records reservation and review events as metrics and audit log lines.
 * Conflict warnings are throttled per asset to avoid log spam from keep-alive retries.
 */
@Component
class WorkflowEventsListener {

    private static final Logger LOG = LogManager.getLogger(WorkflowEventsListener.class);
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    WorkflowEventsListener(WorkflowMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @EventListener
    void onObtained(ReservationObtainedEvent e) {
        metrics.recordReservation(e.renewal() ? "renewed" : "granted");
        if (!e.renewal()) {
            LOG.info("Reservation obtained: asset={}, holder={}, expiresAt={}", e.assetId(), e.holder(), e.expiresAt());
        } else {
            LOG.debug("Reservation renewed: asset={}, holder={}, expiresAt={}", e.assetId(), e.holder(), e.expiresAt());
        }
    }

    @EventListener
    void onReleased(ReservationReleasedEvent e) {
        metrics.recordRelease(e.reason().name().toLowerCase());
        LOG.info("Reservation released: asset={}, holder={}, reason={}", e.assetId(), e.holder(), e.reason());
    }

    @EventListener
    void onExpired(ReservationExpiredEvent e) {
        metrics.recordReservation("expired");
        if (e.tombstoned()) {
            LOG.info("Reservation refused: asset={}, holder={} reached the maximum hold", e.assetId(), e.holder());
        } else {
            LOG.info("Reservation expired: asset={}, holder={}", e.assetId(), e.holder());
        }
    }

    @EventListener
    void onConflict(ReservationConflictEvent e) {
        metrics.recordReservation(e.failedClosed() ? "failed_closed" : "conflict");
        if (shouldLog("conflict-" + e.assetId())) {
            LOG.warn("Reservation refused: asset={}, requester={}, failedClosed={}",
                    e.assetId(), e.requester(), e.failedClosed());
        }
    }

    @EventListener
    void onStatusChanged(TranscriptionStatusChangedEvent e) {
        metrics.recordTransition(e.operation());
        LOG.info("Transcription {}: asset={}, version={}, {} -> {}, actor={}",
                e.operation(), e.assetId(), e.versionId(), e.from().wireName(), e.to().wireName(), e.actor());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        // drop keys past the throttle window
        lastLog.values().removeIf(at -> Duration.between(at, now).compareTo(THROTTLE) >= 0);
        Instant prev = lastLog.putIfAbsent(key, now);
        return prev == null;
    }

    int throttledKeys() {
        return lastLog.size();
    }
}
