package com.phillippitts.scriptorium.client;

import com.phillippitts.scriptorium.exception.ScriptoriumException;

/**
 * Transient failure talking to the reservation endpoints: network error, timeout or an
 * unexpected HTTP status. Keep-alive retries on its next tick.
 */
public class ReservationTransportException extends ScriptoriumException {

    private final Integer statusCode;

    public ReservationTransportException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ReservationTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    /** HTTP status received, or {@code null} if no response arrived. */
    public Integer getStatusCode() {
        return statusCode;
    }
}
