package com.phillippitts.scriptorium.exception;

/**
 * Base exception for all scriptorium application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ScriptoriumException extends RuntimeException {

    public ScriptoriumException(String message) {
        super(message);
    }

    public ScriptoriumException(String message, Throwable cause) {
        super(message, cause);
    }

    public ScriptoriumException(Throwable cause) {
        super(cause);
    }
}
