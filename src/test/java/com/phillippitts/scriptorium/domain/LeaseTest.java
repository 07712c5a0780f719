package com.phillippitts.scriptorium.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeaseTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    @Test
    void isLiveStrictlyBeforeExpiry() {
        Lease lease = new Lease("42", "alice", T0, T0.plusSeconds(300));

        assertThat(lease.isLiveAt(T0.plusSeconds(299))).isTrue();
        assertThat(lease.isLiveAt(T0.plusSeconds(300))).isFalse();
    }

    @Test
    void extendToNeverShortens() {
        Lease lease = new Lease("42", "alice", T0, T0.plusSeconds(300));

        assertThat(lease.extendTo(T0.plusSeconds(100))).isSameAs(lease);
        assertThat(lease.extendTo(T0.plusSeconds(400)).expiresAt()).isEqualTo(T0.plusSeconds(400));
    }

    @Test
    void extendKeepsHolderAndAcquisitionTime() {
        Lease extended = new Lease("42", "alice", T0, T0.plusSeconds(300)).extendTo(T0.plusSeconds(600));

        assertThat(extended.holder()).isEqualTo("alice");
        assertThat(extended.acquiredAt()).isEqualTo(T0);
    }

    @Test
    void rejectsExpiryBeforeAcquisition() {
        assertThatThrownBy(() -> new Lease("42", "alice", T0, T0.minusSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
