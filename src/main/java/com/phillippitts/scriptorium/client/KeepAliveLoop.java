package com.phillippitts.scriptorium.client;

import com.phillippitts.scriptorium.domain.ReservationStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Renews one editing session's reservation on a fixed interval until stopped.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * NEW → RUNNING (start; first renewal fires immediately)
 * RUNNING → LOCKED (server answered CONFLICT)
 * NEW | RUNNING | LOCKED → STOPPED (stop)
 * </pre>
 *
 * <p>Transport failures never end the loop. EXPIRED triggers one immediate re-acquire; if that
 * also conflicts the loop locks like any other conflict.
 *
 * <p>{@link #stop()} cancels the schedule and hands a best-effort release to a separate executor
 * without waiting for it. A lost release is harmless because the lease lapses on its own.
 */
public final class KeepAliveLoop {

    private static final Logger LOG = LogManager.getLogger(KeepAliveLoop.class);

    enum State { NEW, RUNNING, LOCKED, STOPPED }

    private final ReservationClient client;
    private final String assetId;
    private final String holder;
    private final KeepAliveListener listener;
    private final TaskScheduler scheduler;
    private final Executor releaseExecutor;
    private final Duration interval;

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private volatile ScheduledFuture<?> task;
    private volatile boolean reacquirePending;

    public KeepAliveLoop(ReservationClient client,
                         String assetId,
                         String holder,
                         KeepAliveListener listener,
                         TaskScheduler scheduler,
                         Executor releaseExecutor,
                         Duration interval) {
        this.client = Objects.requireNonNull(client, "client");
        this.assetId = Objects.requireNonNull(assetId, "assetId");
        this.holder = Objects.requireNonNull(holder, "holder");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.releaseExecutor = Objects.requireNonNull(releaseExecutor, "releaseExecutor");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }

    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Keep-alive for asset " + assetId + " already started");
        }
        task = scheduler.scheduleAtFixedRate(withContext(ThreadContext.getImmutableContext()), interval);
        LOG.debug("Keep-alive started for asset {} every {}s", assetId, interval.toSeconds());
    }

    /**
     * Ends the session. Idempotent. Releases the reservation unless the loop already lost it.
     */
    public void stop() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) {
            return;
        }
        cancelTask();
        if (previous == State.RUNNING) {
            releaseExecutor.execute(this::releaseQuietly);
        }
        LOG.debug("Keep-alive stopped for asset {} (was {})", assetId, previous);
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    State state() {
        return state.get();
    }

    // Package-private for tests
    void tick() {
        if (state.get() != State.RUNNING) {
            return;
        }
        try {
            ReservationStatus status = client.reserve(assetId, holder);
            if (state.get() == State.STOPPED) {
                // stop() raced this renewal; its release may have landed before our reserve
                if (status == ReservationStatus.GRANTED) {
                    releaseExecutor.execute(this::releaseQuietly);
                }
                return;
            }
            handle(status, true);
        } catch (ReservationTransportException e) {
            LOG.warn("Keep-alive for asset {} failed, retrying next tick: {}", assetId, e.getMessage());
            listener.onTransientFailure(assetId, e);
        } catch (RuntimeException e) {
            // must not escape: a periodic task that throws is never run again
            LOG.error("Keep-alive tick for asset {} failed unexpectedly", assetId, e);
        }
    }

    private Runnable withContext(Map<String, String> context) {
        return () -> {
            ThreadContext.putAll(context);
            try {
                tick();
            } finally {
                ThreadContext.clearMap();
            }
        };
    }

    private void handle(ReservationStatus status, boolean mayReacquire) {
        switch (status) {
            case GRANTED -> {
                if (reacquirePending) {
                    reacquirePending = false;
                    listener.onReacquired(assetId);
                } else {
                    listener.onGranted(assetId);
                }
            }
            case CONFLICT -> lock();
            case EXPIRED -> {
                reacquirePending = true;
                if (mayReacquire) {
                    LOG.info("Reservation on asset {} expired; re-acquiring", assetId);
                    handle(client.reserve(assetId, holder), false);
                } else {
                    LOG.warn("Re-acquire of asset {} reported EXPIRED again; retrying next tick", assetId);
                }
            }
            default -> throw new IllegalStateException("Unhandled reservation status: " + status);
        }
    }

    private void lock() {
        if (state.compareAndSet(State.RUNNING, State.LOCKED)) {
            cancelTask();
            reacquirePending = false;
            LOG.info("Asset {} is reserved by another editor; keep-alive stopped", assetId);
            listener.onConflict(assetId);
        }
    }

    private void cancelTask() {
        ScheduledFuture<?> current = task;
        if (current != null) {
            current.cancel(false);
        }
    }

    private void releaseQuietly() {
        try {
            client.release(assetId, holder);
            LOG.debug("Released reservation on asset {}", assetId);
        } catch (RuntimeException e) {
            LOG.warn("Best-effort release of asset {} failed; lease will lapse: {}", assetId, e.getMessage());
        }
    }
}
