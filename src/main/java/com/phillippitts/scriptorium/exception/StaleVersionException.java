package com.phillippitts.scriptorium.exception;

/**
 * Thrown when a mutation names a version that is no longer the asset's active version.
 */
public class StaleVersionException extends ScriptoriumException {

    private final String assetId;
    private final Long expectedVersionId;
    private final Long activeVersionId;

    public StaleVersionException(String assetId, Long expectedVersionId, Long activeVersionId, String reason) {
        super(reason + " (asset=" + assetId + ", expected=" + expectedVersionId
                + ", active=" + activeVersionId + ")");
        this.assetId = assetId;
        this.expectedVersionId = expectedVersionId;
        this.activeVersionId = activeVersionId;
    }

    public String getAssetId() {
        return assetId;
    }

    public Long getExpectedVersionId() {
        return expectedVersionId;
    }

    public Long getActiveVersionId() {
        return activeVersionId;
    }
}
