package com.sitesmith.core.error;

/**
 * The project store could not write its state to durable storage. Always fatal
 * to the calling operation.
 */
public class PersistenceFailedException extends SitesmithException {

    public PersistenceFailedException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE_FAILED, message, cause);
    }
}
