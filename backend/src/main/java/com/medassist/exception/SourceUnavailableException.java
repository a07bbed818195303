package com.medassist.exception;

/**
 * A fact or evidence provider failed or timed out.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String sourceName;

    public SourceUnavailableException(String sourceName, String message) {
        super(sourceName + " unavailable: " + message);
        this.sourceName = sourceName;
    }

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(sourceName + " unavailable: " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
