package com.phillippitts.scriptorium.service.ocr;

import com.phillippitts.scriptorium.config.properties.OcrProperties;
import com.phillippitts.scriptorium.exception.OcrUnavailableException;
import com.phillippitts.scriptorium.service.ratelimit.SlidingWindowRateLimiter;
import com.phillippitts.scriptorium.service.review.TranscriptionOutcome;
import com.phillippitts.scriptorium.service.review.TranscriptionWorkflow;
import com.phillippitts.scriptorium.util.AssetLogContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

/**
 * Runs OCR for an asset and records the result as its new active version.
 *
 * <p>Flow:
 * <ol>
 *   <li>Check the caller could write over {@code supersedes} (status, lease, active version)</li>
 *   <li>Take a per-asset rate-limit permit</li>
 *   <li>Call the engine without holding the asset lock</li>
 *   <li>Re-validate and append atomically; the asset may have changed while the engine ran</li>
 * </ol>
 */
@Service
public class OcrTranscriptionService {

    private static final Logger LOG = LogManager.getLogger(OcrTranscriptionService.class);

    private final OcrEngine engine;
    private final TranscriptionWorkflow workflow;
    private final OcrProperties props;
    private final SlidingWindowRateLimiter limiter;

    public OcrTranscriptionService(OcrEngine engine,
                                   TranscriptionWorkflow workflow,
                                   OcrProperties props,
                                   Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.workflow = Objects.requireNonNull(workflow, "workflow");
        this.props = Objects.requireNonNull(props, "props");
        this.limiter = new SlidingWindowRateLimiter(props.getCallsPerWindow(), props.getWindow(), clock);
    }

    /**
     * @param language   engine language, or {@code null} for the configured default
     * @param supersedes the version the caller is looking at, or {@code null} if none
     * @throws OcrUnavailableException if OCR is disabled or the engine fails
     * @throws com.phillippitts.scriptorium.exception.RateLimitedException if the asset was OCR'd too recently
     */
    public TranscriptionOutcome transcribe(String assetId, String language, Long supersedes, String actor) {
        if (!props.isEnabled()) {
            throw new OcrUnavailableException(assetId, "OCR is disabled");
        }
        String lang = language == null || language.isBlank() ? props.getDefaultLanguage() : language;
        try (AssetLogContext ignored = AssetLogContext.bind(assetId)) {
            workflow.checkWritable(assetId, supersedes, actor);
            limiter.acquire(assetId, "ocr");

            String text;
            long start = System.nanoTime();
            try {
                text = engine.recognize(assetId, lang);
            } catch (OcrUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new OcrUnavailableException(assetId, "OCR engine " + engine.getEngineName() + " failed", e);
            }
            if (text == null) {
                throw new OcrUnavailableException(assetId, "OCR engine " + engine.getEngineName() + " returned no text");
            }
            LOG.info("OCR ({}, {}) finished in {} ms", engine.getEngineName(), lang,
                    (System.nanoTime() - start) / 1_000_000L);
            return workflow.recordOcr(assetId, text, supersedes, actor);
        }
    }

    public boolean isAvailable() {
        return props.isEnabled() && engine.isHealthy();
    }
}
