package com.phillippitts.scriptorium.exception;

/**
 * Thrown when undo has no earlier version or redo has nothing to restore.
 */
public class HistoryUnavailableException extends ScriptoriumException {

    private final String assetId;

    public HistoryUnavailableException(String assetId, String message) {
        super(message);
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }
}
