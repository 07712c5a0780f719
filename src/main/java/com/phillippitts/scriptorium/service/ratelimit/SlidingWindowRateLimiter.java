package com.phillippitts.scriptorium.service.ratelimit;

import com.phillippitts.scriptorium.exception.RateLimitedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-key sliding-window limiter: at most {@code permits} acquisitions per key within any
 * {@code window}.
 *
 * <p>Each key keeps the timestamps of its recent acquisitions, only ever touched inside
 * {@link ConcurrentMap#compute} for that key. Entries older than the window are dropped on every
 * call, and a key with no recent acquisitions is removed. Idle keys nobody asks about again are
 * swept at most once per window.
 */
public class SlidingWindowRateLimiter {

    private final int permits;
    private final Duration window;
    private final Clock clock;
    private final ConcurrentMap<String, Deque<Instant>> history = new ConcurrentHashMap<>();
    private volatile Instant nextSweep = Instant.MIN;

    public SlidingWindowRateLimiter(int permits, Duration window, Clock clock) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive: " + permits);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.permits = permits;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Takes one permit for {@code key}.
     *
     * @param operation name reported in the exception
     * @throws RateLimitedException with the time until the oldest acquisition leaves the window
     */
    public void acquire(String key, String operation) {
        Instant now = clock.instant();
        sweepIfDue(now);
        history.compute(key, (k, times) -> {
            Deque<Instant> recent = times == null ? new ArrayDeque<>() : times;
            prune(recent, now);
            if (recent.size() >= permits) {
                Duration retryAfter = Duration.between(now, recent.peekFirst().plus(window));
                throw new RateLimitedException(operation, retryAfter.isNegative() ? Duration.ZERO : retryAfter);
            }
            recent.addLast(now);
            return recent;
        });
    }

    /**
     * Gives back the most recent permit of {@code key}, for a request that was refused after
     * acquiring it.
     */
    public void refund(String key) {
        history.computeIfPresent(key, (k, times) -> {
            times.pollLast();
            return times.isEmpty() ? null : times;
        });
    }

    /** Permits still available to {@code key} right now. */
    public int remaining(String key) {
        Instant now = clock.instant();
        int[] recent = new int[1];
        history.computeIfPresent(key, (k, times) -> {
            prune(times, now);
            recent[0] = times.size();
            return times.isEmpty() ? null : times;
        });
        return Math.max(0, permits - recent[0]);
    }

    /** Number of keys currently tracked. */
    int trackedKeys() {
        return history.size();
    }

    private void sweepIfDue(Instant now) {
        if (now.isBefore(nextSweep)) {
            return;
        }
        nextSweep = now.plus(window);
        for (String key : history.keySet()) {
            history.computeIfPresent(key, (k, times) -> {
                prune(times, now);
                return times.isEmpty() ? null : times;
            });
        }
    }

    private void prune(Deque<Instant> times, Instant now) {
        Instant cutoff = now.minus(window);
        while (!times.isEmpty() && !times.peekFirst().isAfter(cutoff)) {
            times.pollFirst();
        }
    }
}
