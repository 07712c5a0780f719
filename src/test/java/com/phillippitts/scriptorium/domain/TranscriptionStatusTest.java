package com.phillippitts.scriptorium.domain;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptionStatusTest {

    @Test
    void onlyNotStartedAndInProgressAreEditable() {
        assertThat(EnumSet.allOf(TranscriptionStatus.class))
                .filteredOn(TranscriptionStatus::isEditable)
                .containsExactlyInAnyOrder(TranscriptionStatus.NOT_STARTED, TranscriptionStatus.IN_PROGRESS);
    }

    @Test
    void allowsExactlyTheDocumentedTransitions() {
        assertThat(TranscriptionStatus.NOT_STARTED.canTransitionTo(TranscriptionStatus.IN_PROGRESS)).isTrue();
        assertThat(TranscriptionStatus.IN_PROGRESS.canTransitionTo(TranscriptionStatus.IN_PROGRESS)).isTrue();
        assertThat(TranscriptionStatus.IN_PROGRESS.canTransitionTo(TranscriptionStatus.SUBMITTED)).isTrue();
        assertThat(TranscriptionStatus.SUBMITTED.canTransitionTo(TranscriptionStatus.COMPLETED)).isTrue();
        assertThat(TranscriptionStatus.SUBMITTED.canTransitionTo(TranscriptionStatus.IN_PROGRESS)).isTrue();

        int allowed = 0;
        for (TranscriptionStatus from : TranscriptionStatus.values()) {
            for (TranscriptionStatus to : TranscriptionStatus.values()) {
                if (from.canTransitionTo(to)) {
                    allowed++;
                }
            }
        }
        assertThat(allowed).isEqualTo(5);
    }

    @Test
    void completedIsTerminal() {
        for (TranscriptionStatus to : TranscriptionStatus.values()) {
            assertThat(TranscriptionStatus.COMPLETED.canTransitionTo(to)).isFalse();
        }
    }

    @Test
    void cannotSkipReviewOrSubmitFromNotStarted() {
        assertThat(TranscriptionStatus.IN_PROGRESS.canTransitionTo(TranscriptionStatus.COMPLETED)).isFalse();
        assertThat(TranscriptionStatus.NOT_STARTED.canTransitionTo(TranscriptionStatus.SUBMITTED)).isFalse();
    }

    @Test
    void wireNamesAreSnakeCase() {
        assertThat(TranscriptionStatus.NOT_STARTED.wireName()).isEqualTo("not_started");
        assertThat(TranscriptionStatus.IN_PROGRESS.wireName()).isEqualTo("in_progress");
        assertThat(TranscriptionStatus.SUBMITTED.wireName()).isEqualTo("submitted");
        assertThat(TranscriptionStatus.COMPLETED.wireName()).isEqualTo("completed");
    }
}
