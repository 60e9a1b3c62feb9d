package com.sitesmith.core.error;

/**
 * Base class for failures raised by the project store and its orchestration.
 * Each subclass maps to exactly one {@link ErrorKind}.
 */
public abstract class SitesmithException extends RuntimeException {

    private final ErrorKind kind;

    protected SitesmithException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected SitesmithException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
