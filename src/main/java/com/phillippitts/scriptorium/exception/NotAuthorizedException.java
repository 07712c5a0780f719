package com.phillippitts.scriptorium.exception;

/**
 * Thrown for requests the caller may never make as-is: reviewing their own work,
 * editing without a reservation, or submitting someone else's version.
 */
public class NotAuthorizedException extends ScriptoriumException {

    private final String actor;

    public NotAuthorizedException(String actor, String reason) {
        super(reason);
        this.actor = actor;
    }

    public String getActor() {
        return actor;
    }
}
