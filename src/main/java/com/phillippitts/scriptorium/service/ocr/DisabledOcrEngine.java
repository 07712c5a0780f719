package com.phillippitts.scriptorium.service.ocr;

import com.phillippitts.scriptorium.exception.OcrUnavailableException;

/**
 * Engine used when no OCR backend is configured. Every call fails with
 * {@link OcrUnavailableException}.
 */
public class DisabledOcrEngine implements OcrEngine {

    @Override
    public String recognize(String assetId, String language) {
        throw new OcrUnavailableException(assetId, "No OCR engine is configured");
    }

    @Override
    public String getEngineName() {
        return "disabled";
    }

    @Override
    public boolean isHealthy() {
        return false;
    }
}
