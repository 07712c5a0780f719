package com.phillippitts.scriptorium.service.ocr;

import com.phillippitts.scriptorium.exception.OcrUnavailableException;

/**
 * Contract for optical character recognition of an asset's page image.
 *
 * <p>The engine is an external collaborator: calls are synchronous, may be slow, and are never
 * retried by the caller. Callers rate-limit invocations per asset.
 *
 * <p>Thread Safety: Implementations must be thread-safe.
 */
public interface OcrEngine {

    /**
     * Extracts the text of the asset's page image.
     *
     * @param assetId  asset whose image is read
     * @param language engine language code, e.g. {@code eng}
     * @return recognized text, possibly empty
     * @throws OcrUnavailableException if the engine cannot produce text
     */
    String recognize(String assetId, String language);

    /**
     * Returns the name of this engine for logging and monitoring.
     */
    String getEngineName();

    /**
     * Checks if the engine is currently able to accept requests.
     */
    boolean isHealthy();
}
