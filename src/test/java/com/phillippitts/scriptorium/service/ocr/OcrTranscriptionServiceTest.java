package com.phillippitts.scriptorium.service.ocr;

import com.phillippitts.scriptorium.config.properties.OcrProperties;
import com.phillippitts.scriptorium.config.properties.ReservationProperties;
import com.phillippitts.scriptorium.config.properties.ReviewProperties;
import com.phillippitts.scriptorium.exception.NotAuthorizedException;
import com.phillippitts.scriptorium.exception.OcrUnavailableException;
import com.phillippitts.scriptorium.exception.RateLimitedException;
import com.phillippitts.scriptorium.exception.StaleVersionException;
import com.phillippitts.scriptorium.service.asset.AssetRegistry;
import com.phillippitts.scriptorium.service.chain.InMemoryVersionStore;
import com.phillippitts.scriptorium.service.chain.TranscriptionChain;
import com.phillippitts.scriptorium.service.lease.InMemoryLeaseStore;
import com.phillippitts.scriptorium.service.reservation.ReservationManager;
import com.phillippitts.scriptorium.service.review.TranscriptionOutcome;
import com.phillippitts.scriptorium.service.review.TranscriptionWorkflow;
import com.phillippitts.scriptorium.testutil.EventCapturingPublisher;
import com.phillippitts.scriptorium.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OcrTranscriptionServiceTest {

    private MutableClock clock;
    private OcrProperties props;
    private ReservationManager reservations;
    private TranscriptionWorkflow workflow;
    private OcrEngine engine;
    private OcrTranscriptionService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        ReservationProperties reservationProps = new ReservationProperties();
        AssetRegistry assets = new AssetRegistry();
        reservations = new ReservationManager(
                new InMemoryLeaseStore(clock, reservationProps), reservationProps, publisher, clock);
        TranscriptionChain chain = new TranscriptionChain(new InMemoryVersionStore(), assets, clock);
        workflow = new TranscriptionWorkflow(reservations, chain, assets, new ReviewProperties(), publisher, clock);

        props = new OcrProperties();
        props.setEnabled(true);
        engine = mock(OcrEngine.class);
        when(engine.getEngineName()).thenReturn("fake");
        service = new OcrTranscriptionService(engine, workflow, props, clock);
    }

    @Test
    void recordsEngineOutputAsNewActiveVersion() {
        reservations.reserve("42", "alice");
        when(engine.recognize("42", "deu")).thenReturn("Sehr geehrter Herr");

        TranscriptionOutcome outcome = service.transcribe("42", "deu", null, "alice");

        assertThat(outcome.version().text()).isEqualTo("Sehr geehrter Herr");
        assertThat(outcome.version().ocrGenerated()).isTrue();
    }

    @Test
    void blankLanguageFallsBackToDefault() {
        reservations.reserve("42", "alice");
        when(engine.recognize("42", "eng")).thenReturn("Dear Sir");

        assertThat(service.transcribe("42", " ", null, "alice").version().text()).isEqualTo("Dear Sir");
    }

    @Test
    void secondCallWithinWindowIsRateLimitedPerAsset() {
        reservations.reserve("42", "alice");
        when(engine.recognize(anyString(), anyString())).thenReturn("text");
        long first = service.transcribe("42", null, null, "alice").version().id();

        assertThatThrownBy(() -> service.transcribe("42", null, first, "alice"))
                .isInstanceOf(RateLimitedException.class);

        clock.advance(Duration.ofMinutes(1));
        assertThat(service.transcribe("42", null, first, "alice").version().supersedes()).isEqualTo(first);
    }

    @Test
    void doomedRequestDoesNotReachEngineOrConsumePermit() {
        assertThatThrownBy(() -> service.transcribe("42", null, null, "alice"))
                .isInstanceOf(NotAuthorizedException.class);
        verify(engine, never()).recognize(anyString(), anyString());

        reservations.reserve("42", "alice");
        when(engine.recognize(anyString(), anyString())).thenReturn("text");
        assertThat(service.transcribe("42", null, null, "alice").version().text()).isEqualTo("text");
    }

    @Test
    void assetChangedWhileEngineRanIsConflict() {
        reservations.reserve("42", "alice");
        when(engine.recognize(anyString(), anyString())).thenAnswer(invocation -> {
            workflow.save("42", "typed meanwhile", null, "alice");
            return "late OCR";
        });

        assertThatThrownBy(() -> service.transcribe("42", null, null, "alice"))
                .isInstanceOf(StaleVersionException.class);
    }

    @Test
    void engineFailureIsReportedAsUnavailable() {
        reservations.reserve("42", "alice");
        when(engine.recognize(anyString(), anyString())).thenThrow(new IllegalStateException("tesseract crashed"));

        assertThatThrownBy(() -> service.transcribe("42", null, null, "alice"))
                .isInstanceOf(OcrUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void disabledOcrIsUnavailable() {
        props.setEnabled(false);

        assertThatThrownBy(() -> service.transcribe("42", null, null, "alice"))
                .isInstanceOf(OcrUnavailableException.class)
                .hasMessageContaining("disabled");
        assertThat(service.isAvailable()).isFalse();
    }

    @Test
    void defaultEngineAlwaysRefuses() {
        DisabledOcrEngine disabled = new DisabledOcrEngine();

        assertThat(disabled.isHealthy()).isFalse();
        assertThatThrownBy(() -> disabled.recognize("42", "eng")).isInstanceOf(OcrUnavailableException.class);
    }
}
