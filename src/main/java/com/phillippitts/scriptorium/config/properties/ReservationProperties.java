package com.phillippitts.scriptorium.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for asset reservations (edit leases).
 *
 * <p>The lease {@code ttl} must exceed the client {@code keepAliveInterval} by at least
 * {@code safetyMargin}; {@link com.phillippitts.scriptorium.config.ReservationConfigurationValidator}
 * enforces this at startup.
 */
@ConfigurationProperties(prefix = "scriptorium.reservation")
@Validated
public class ReservationProperties {

    /** Lease lifetime after the last renewal. */
    @NotNull
    private Duration ttl = Duration.ofMinutes(5);

    /** Client renewal cadence. */
    @NotNull
    private Duration keepAliveInterval = Duration.ofSeconds(60);

    /** Minimum slack between keep-alive interval and ttl. */
    @NotNull
    private Duration safetyMargin = Duration.ofSeconds(60);

    /** Absolute cap on a single lease, measured from acquisition. */
    @NotNull
    private Duration maxHold = Duration.ofHours(12);

    /**
     * How long a holder stays locked out after its lease reached {@code maxHold}. Other editors may
     * take the asset over meanwhile.
     */
    @NotNull
    private Duration tombstoneLength = Duration.ofHours(1);

    /** How long a lapsed lease record lingers before housekeeping purges it. */
    @NotNull
    private Duration purgeGrace = Duration.ofMinutes(10);

    /** Housekeeping sweep period. */
    @NotNull
    private Duration housekeepingInterval = Duration.ofSeconds(60);

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getKeepAliveInterval() {
        return keepAliveInterval;
    }

    public void setKeepAliveInterval(Duration keepAliveInterval) {
        this.keepAliveInterval = keepAliveInterval;
    }

    public Duration getSafetyMargin() {
        return safetyMargin;
    }

    public void setSafetyMargin(Duration safetyMargin) {
        this.safetyMargin = safetyMargin;
    }

    public Duration getMaxHold() {
        return maxHold;
    }

    public void setMaxHold(Duration maxHold) {
        this.maxHold = maxHold;
    }

    public Duration getTombstoneLength() {
        return tombstoneLength;
    }

    public void setTombstoneLength(Duration tombstoneLength) {
        this.tombstoneLength = tombstoneLength;
    }

    public Duration getPurgeGrace() {
        return purgeGrace;
    }

    public void setPurgeGrace(Duration purgeGrace) {
        this.purgeGrace = purgeGrace;
    }

    public Duration getHousekeepingInterval() {
        return housekeepingInterval;
    }

    public void setHousekeepingInterval(Duration housekeepingInterval) {
        this.housekeepingInterval = housekeepingInterval;
    }
}
