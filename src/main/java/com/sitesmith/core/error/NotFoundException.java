package com.sitesmith.core.error;

/**
 * Unknown project, version or asset id.
 */
public class NotFoundException extends SitesmithException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException project(String projectId) {
        return new NotFoundException("Project not found: " + projectId);
    }
}
