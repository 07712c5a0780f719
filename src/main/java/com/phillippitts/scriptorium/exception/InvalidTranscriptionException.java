package com.phillippitts.scriptorium.exception;

/**
 * Thrown when request content is malformed: text containing URLs, an unknown supersedes id,
 * or an unrecognised review action.
 */
public class InvalidTranscriptionException extends ScriptoriumException {

    private final String reason;

    public InvalidTranscriptionException(String reason) {
        super("Invalid transcription request: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
