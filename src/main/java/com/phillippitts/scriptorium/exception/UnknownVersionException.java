package com.phillippitts.scriptorium.exception;

public class UnknownVersionException extends ScriptoriumException {

    private final long versionId;

    public UnknownVersionException(long versionId) {
        super("Transcription version not found: " + versionId);
        this.versionId = versionId;
    }

    public long getVersionId() {
        return versionId;
    }
}
