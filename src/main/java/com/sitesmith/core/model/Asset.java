package com.sitesmith.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.Instant;

/**
 * An uploaded image after normalization and captioning.
 *
 * @param id          unique per project
 * @param url         public URL under the project's domain
 * @param filename    stored filename, extension matching {@code contentType}
 * @param uploadedAt  upload timestamp
 * @param contentType canonical image MIME type
 * @param description caption followed by geometry facts
 */
public record Asset(
    String id,
    String url,
    String filename,
    Instant uploadedAt,
    @JsonAlias("type") String contentType,
    String description
) {}
