package com.phillippitts.scriptorium.service.events;

import com.phillippitts.scriptorium.domain.TranscriptionStatus;
import com.phillippitts.scriptorium.service.metrics.WorkflowMetrics;
import com.phillippitts.scriptorium.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowEventsListenerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private WorkflowEventsListener listener;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        listener = new WorkflowEventsListener(new WorkflowMetrics(registry), clock);
    }

    @Test
    void countsGrantedAndRenewedSeparately() {
        listener.onObtained(new ReservationObtainedEvent("a1", "alice", NOW, false));
        listener.onObtained(new ReservationObtainedEvent("a1", "alice", NOW, true));
        listener.onObtained(new ReservationObtainedEvent("a1", "alice", NOW, true));

        assertThat(count("scriptorium.reservation.outcome", "outcome", "granted")).isEqualTo(1.0);
        assertThat(count("scriptorium.reservation.outcome", "outcome", "renewed")).isEqualTo(2.0);
    }

    @Test
    void countsReleasesByReason() {
        listener.onReleased(new ReservationReleasedEvent("a1", "alice",
                ReservationReleasedEvent.Reason.COMPLETED, NOW));

        assertThat(count("scriptorium.reservation.release", "reason", "completed")).isEqualTo(1.0);
    }

    @Test
    void countsFailClosedConflictsApartFromContention() {
        listener.onConflict(new ReservationConflictEvent("a1", "bob", false));
        listener.onConflict(new ReservationConflictEvent("a1", "bob", true));

        assertThat(count("scriptorium.reservation.outcome", "outcome", "conflict")).isEqualTo(1.0);
        assertThat(count("scriptorium.reservation.outcome", "outcome", "failed_closed")).isEqualTo(1.0);
    }

    @Test
    void countsTransitionsByOperation() {
        listener.onStatusChanged(new TranscriptionStatusChangedEvent("a1", 3L,
                TranscriptionStatus.IN_PROGRESS, TranscriptionStatus.SUBMITTED, "submit", "alice", NOW));

        assertThat(count("scriptorium.review.transition", "action", "submit")).isEqualTo(1.0);
    }

    @Test
    void throttlesRepeatedLogKeys() {
        assertThat(listener.shouldLog("conflict-a1")).isTrue();
        assertThat(listener.shouldLog("conflict-a1")).isFalse();
        assertThat(listener.shouldLog("conflict-a2")).isTrue();
    }

    @Test
    void throttleForgetsKeysOnceTheirWindowPasses() {
        for (int i = 0; i < 100; i++) {
            listener.shouldLog("conflict-a" + i);
        }
        assertThat(listener.throttledKeys()).isEqualTo(100);

        clock.advance(Duration.ofMinutes(1));

        assertThat(listener.shouldLog("conflict-a1")).isTrue();
        assertThat(listener.throttledKeys()).isEqualTo(1);
    }

    @Test
    void countsExpiredReservationsIncludingLockouts() {
        listener.onExpired(new ReservationExpiredEvent("a1", "alice", false, NOW));
        listener.onExpired(new ReservationExpiredEvent("a1", "alice", true, NOW));

        assertThat(count("scriptorium.reservation.outcome", "outcome", "expired")).isEqualTo(2.0);
    }

    private double count(String name, String tag, String value) {
        return registry.get(name).tag(tag, value).counter().count();
    }
}
