package com.sitesmith.dispatch.api;

/**
 * Inbound JSON body for PUT /api/v1/projects/{id}/deploy.
 *
 * @param versionIndex index of the version to publish; required
 */
public record DeployRequest(Integer versionIndex) {}
