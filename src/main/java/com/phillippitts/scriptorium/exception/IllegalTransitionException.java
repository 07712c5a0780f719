package com.phillippitts.scriptorium.exception;

import com.phillippitts.scriptorium.domain.TranscriptionStatus;

/**
 * Thrown when an operation is not permitted from the asset's current review status,
 * typically because another actor changed it first.
 */
public class IllegalTransitionException extends ScriptoriumException {

    private final String assetId;
    private final TranscriptionStatus currentStatus;
    private final String operation;

    public IllegalTransitionException(String assetId, TranscriptionStatus currentStatus, String operation) {
        super("Cannot " + operation + " asset " + assetId + " while it is " + currentStatus.wireName());
        this.assetId = assetId;
        this.currentStatus = currentStatus;
        this.operation = operation;
    }

    public String getAssetId() {
        return assetId;
    }

    public TranscriptionStatus getCurrentStatus() {
        return currentStatus;
    }

    public String getOperation() {
        return operation;
    }
}
