package com.phillippitts.scriptorium.exception;

/**
 * Thrown when a backing store (lease store or version store) cannot be reached.
 */
public class StoreUnavailableException extends ScriptoriumException {

    private final String storeName;

    public StoreUnavailableException(String storeName, String message) {
        super(storeName + " unavailable: " + message);
        this.storeName = storeName;
    }

    public StoreUnavailableException(String storeName, String message, Throwable cause) {
        super(storeName + " unavailable: " + message, cause);
        this.storeName = storeName;
    }

    public String getStoreName() {
        return storeName;
    }
}
