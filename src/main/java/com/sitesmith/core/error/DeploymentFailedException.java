package com.sitesmith.core.error;

/**
 * The object store rejected the HTML write during a publish. The deployed
 * pointer is left as it was.
 */
public class DeploymentFailedException extends SitesmithException {

    public DeploymentFailedException(String message, Throwable cause) {
        super(ErrorKind.DEPLOYMENT_FAILED, message, cause);
    }
}
