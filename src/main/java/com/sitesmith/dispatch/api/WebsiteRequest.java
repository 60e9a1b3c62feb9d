package com.sitesmith.dispatch.api;

import java.util.List;

/**
 * Inbound JSON body for website generation.
 *
 * @param instructions  what to build or change
 * @param context       extra facts for the generator; nullable
 * @param targetSection section name to rewrite; update only, nullable
 * @param versionId     version to start from; update only, nullable means current
 * @param assetIds      project assets to place in the page; nullable
 */
public record WebsiteRequest(
    String instructions,
    String context,
    String targetSection,
    String versionId,
    List<String> assetIds
) {}
