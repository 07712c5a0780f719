package com.phillippitts.scriptorium.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics for reservations and review transitions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Reservation outcomes (granted, renewed, conflict, expired, failed_closed)</li>
 *   <li>Lease releases by reason</li>
 *   <li>Workflow transitions (save, submit, accept, reject, undo, redo, ocr)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class WorkflowMetrics {

    private static final String METRIC_PREFIX = "scriptorium";

    private final MeterRegistry registry;

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the reservation outcome counter.
     *
     * @param outcome granted, renewed, conflict, expired or failed_closed
     */
    public void recordReservation(String outcome) {
        Counter.builder(METRIC_PREFIX + ".reservation.outcome")
                .description("Reservation requests by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Increments the release counter.
     *
     * @param reason released, completed, expired or purged
     */
    public void recordRelease(String reason) {
        Counter.builder(METRIC_PREFIX + ".reservation.release")
                .description("Leases removed by reason")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Increments the workflow transition counter.
     *
     * @param action workflow operation that changed the asset
     */
    public void recordTransition(String action) {
        Counter.builder(METRIC_PREFIX + ".review.transition")
                .description("Transcription workflow transitions by action")
                .tag("action", action)
                .register(registry)
                .increment();
    }
}
