package com.sitesmith.core.error;

/**
 * Failure categories surfaced to callers of the core operations.
 */
public enum ErrorKind {
    NOT_FOUND,
    VALIDATION,
    UNSUPPORTED_MEDIA_TYPE,
    DEPLOYMENT_FAILED,
    UPSTREAM_UNAVAILABLE,
    PERSISTENCE_FAILED
}
