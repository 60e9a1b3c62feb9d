package com.sitesmith.core.error;

/**
 * An external collaborator (object store, domain registry, text generator,
 * captioner) failed or did not answer within its timeout.
 */
public class UpstreamUnavailableException extends SitesmithException {

    private final String collaborator;

    public UpstreamUnavailableException(String collaborator, String message) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message);
        this.collaborator = collaborator;
    }

    public UpstreamUnavailableException(String collaborator, String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
        this.collaborator = collaborator;
    }

    public String collaborator() {
        return collaborator;
    }
}
