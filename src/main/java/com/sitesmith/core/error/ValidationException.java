package com.sitesmith.core.error;

/**
 * Out-of-range index, missing required field or otherwise unusable input.
 */
public class ValidationException extends SitesmithException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }

    protected ValidationException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
