package com.sitesmith.core.deploy;

/**
 * Outcome of a successful publish.
 *
 * @param url          public URL serving the published version
 * @param versionIndex index now recorded as deployed
 */
public record PublishResult(
    boolean success,
    String message,
    String url,
    String domain,
    int versionIndex
) {}
