package com.phillippitts.scriptorium.exception;

/**
 * Thrown when the OCR engine is disabled or fails to extract text.
 */
public class OcrUnavailableException extends ScriptoriumException {

    private final String assetId;

    public OcrUnavailableException(String assetId, String message) {
        super(message + " (asset: " + assetId + ")");
        this.assetId = assetId;
    }

    public OcrUnavailableException(String assetId, String message, Throwable cause) {
        super(message + " (asset: " + assetId + ")", cause);
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }
}
