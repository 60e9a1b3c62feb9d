package com.sitesmith.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.Instant;

/**
 * A full HTML document snapshot. Never a diff.
 */
public record HtmlVersion(
    String id,
    @JsonAlias("htmlContent") String content,
    Instant createdAt
) {

    /** Same id and timestamp, new content. Only the in-place edit path uses this. */
    public HtmlVersion withContent(String content) {
        return new HtmlVersion(id, content, createdAt);
    }
}
