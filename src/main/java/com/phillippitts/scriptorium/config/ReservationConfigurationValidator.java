package com.phillippitts.scriptorium.config;

import com.phillippitts.scriptorium.config.properties.ReservationProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Validates reservation timing at startup to fail fast with actionable messages.
 */
@Component
class ReservationConfigurationValidator {

    private final ReservationProperties props;

    ReservationConfigurationValidator(ReservationProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        requirePositive(props.getTtl(), "scriptorium.reservation.ttl");
        requirePositive(props.getKeepAliveInterval(), "scriptorium.reservation.keep-alive-interval");
        requirePositive(props.getHousekeepingInterval(), "scriptorium.reservation.housekeeping-interval");
        requirePositive(props.getTombstoneLength(), "scriptorium.reservation.tombstone-length");
        if (props.getSafetyMargin().isNegative()) {
            throw new IllegalArgumentException("scriptorium.reservation.safety-margin must not be negative");
        }
        if (props.getPurgeGrace().isNegative()) {
            throw new IllegalArgumentException("scriptorium.reservation.purge-grace must not be negative");
        }

        Duration minimumTtl = props.getKeepAliveInterval().plus(props.getSafetyMargin());
        if (props.getTtl().compareTo(minimumTtl) < 0) {
            throw new IllegalArgumentException("scriptorium.reservation.ttl (" + props.getTtl()
                    + ") must be at least keep-alive-interval + safety-margin (" + minimumTtl
                    + ") so that network jitter does not expire live editors");
        }
        if (props.getMaxHold().compareTo(props.getTtl()) < 0) {
            throw new IllegalArgumentException("scriptorium.reservation.max-hold (" + props.getMaxHold()
                    + ") must not be shorter than ttl (" + props.getTtl() + ")");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration, got: " + value);
        }
    }
}
